package com.mk.fx.qa.chatflow.execution.resource;

import com.mk.fx.qa.chatflow.execution.dto.ResultRow;
import com.mk.fx.qa.chatflow.execution.model.FinalStatus;
import com.mk.fx.qa.chatflow.execution.model.ResultRecord;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper(componentModel = "spring")
public interface ResultRowMapper {

  @Mapping(target = "sessionId", source = "sessionHandle")
  @Mapping(target = "finalStatus", source = "finalStatus", qualifiedByName = "statusValue")
  ResultRow toRow(ResultRecord record);

  List<ResultRow> toRows(List<ResultRecord> records);

  @Named("statusValue")
  default String statusValue(FinalStatus status) {
    return status != null ? status.value() : null;
  }
}
