package com.mk.fx.qa.dbstress.error;

import com.mk.fx.qa.dbstress.model.EntityKey;

public class DuplicateOperationException extends DashboardException {

  public DuplicateOperationException(EntityKey id) {
    super("Operation already in progress for " + id);
  }
}
