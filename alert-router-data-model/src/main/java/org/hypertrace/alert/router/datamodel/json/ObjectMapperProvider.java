package org.hypertrace.alert.router.datamodel.json;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared mapper for alerts, state records and webhook payloads. Instants are ISO-8601 strings. */
public class ObjectMapperProvider {
  private static volatile ObjectMapper objectMapper;

  private ObjectMapperProvider() {}

  public static ObjectMapper get() {
    if (objectMapper == null) {
      synchronized (ObjectMapperProvider.class) {
        if (objectMapper == null) {
          objectMapper =
              new ObjectMapper()
                  .registerModule(new JavaTimeModule())
                  .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                  .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                  .setSerializationInclusion(Include.NON_NULL);
        }
      }
    }
    return objectMapper;
  }
}
