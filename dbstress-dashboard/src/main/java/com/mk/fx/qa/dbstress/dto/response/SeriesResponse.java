package com.mk.fx.qa.dbstress.dto.response;

import com.mk.fx.qa.dbstress.model.Channel;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.Sample;
import java.util.List;

public record SeriesResponse(EntityKey key, Channel channel, List<Sample> samples) {}
