package com.acme.mailflow.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum FollowUpCondition {
  @JsonProperty("always")
  ALWAYS,
  @JsonProperty("if_not_opened")
  IF_NOT_OPENED,
  @JsonProperty("if_not_replied")
  IF_NOT_REPLIED,
  @JsonProperty("if_not_clicked")
  IF_NOT_CLICKED
}
