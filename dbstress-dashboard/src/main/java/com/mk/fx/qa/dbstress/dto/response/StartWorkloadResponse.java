package com.mk.fx.qa.dbstress.dto.response;

import com.mk.fx.qa.dbstress.model.EntityKey;
import java.util.List;

public record StartWorkloadResponse(boolean success, String message, List<EntityKey> schemas) {}
