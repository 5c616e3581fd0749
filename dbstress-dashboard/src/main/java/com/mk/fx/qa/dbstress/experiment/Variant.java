package com.mk.fx.qa.dbstress.experiment;

import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.WorkloadConfig;
import java.util.Objects;

/** One configuration arm: the workload applied against one entity. */
public record Variant(String label, EntityKey entityKey, WorkloadConfig workload) {

  public Variant {
    Objects.requireNonNull(entityKey, "entityKey");
    Objects.requireNonNull(workload, "workload");
    label = label == null || label.isBlank() ? entityKey.displayName() : label;
  }
}
