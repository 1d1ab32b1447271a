package com.scholary.recipe.media.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

/** Error body returned by every media endpoint: {@code {"error": "...", "details": {...}}}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, Map<String, List<String>> details) {

  public static ErrorResponse of(String error) {
    return new ErrorResponse(error, null);
  }
}
