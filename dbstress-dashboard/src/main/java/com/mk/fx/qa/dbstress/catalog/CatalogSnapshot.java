package com.mk.fx.qa.dbstress.catalog;

import com.mk.fx.qa.dbstress.model.EntityKey;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** The schemas known to the engine at {@code refreshedAt}, with details for those inspected. */
public record CatalogSnapshot(
    List<EntityKey> entities, Map<EntityKey, EntityInfo> details, Instant refreshedAt) {

  public CatalogSnapshot {
    entities = List.copyOf(entities);
    details = Map.copyOf(details);
  }
}
