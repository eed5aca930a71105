package org.bonusly.client.domain;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/** How a user takes part in recognition. */
public enum UserMode {
  @JsonProperty("normal") NORMAL,
  @JsonProperty("observer") OBSERVER,
  @JsonProperty("receiver") RECEIVER,
  @JsonProperty("benefactor") BENEFACTOR,
  @JsonProperty("bot") BOT,
  // modes added server side after this client was built
  @JsonEnumDefaultValue UNKNOWN
}
