package com.example.dispatch.config;

import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/** 制御 API が受け付けるリクエストボディの上限。 */
@ConfigurationProperties(prefix = "digest.control.request")
@Validated
public record ControlRequestProperties(DataSize maxBodySize) {

  public ControlRequestProperties {
    maxBodySize = maxBodySize == null ? DataSize.ofKilobytes(100) : maxBodySize;
  }

  @AssertTrue(message = "digest.control.request.max-body-size must be positive")
  public boolean isMaxBodySizePositive() {
    return maxBodySize.toBytes() > 0;
  }
}
