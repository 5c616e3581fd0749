package com.mk.fx.qa.dbstress.error;

import com.mk.fx.qa.dbstress.model.EntityKey;
import java.util.Collection;

public class AlreadyRunningException extends DashboardException {

  public AlreadyRunningException(Collection<EntityKey> keys) {
    super("Workload already running for " + keys);
  }
}
