package edu.washington.escience.rivulet.util;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.datatype.guava.GuavaModule;

/**
 * Holds the {@link ObjectMapper} used to read and write expressions, aggregate specifications and node options.
 */
public final class JsonMapperProvider {
  /** Only create this object once, and share it. */
  private static final ObjectMapper MAPPER = newMapper();

  /** Utility classes do not have a public constructor. */
  private JsonMapperProvider() {}

  /**
   * @return the shared ObjectMapper.
   */
  public static ObjectMapper getMapper() {
    return MAPPER;
  }

  /**
   * @return an {@link ObjectReader} of the shared mapper.
   */
  public static ObjectReader getReader() {
    return MAPPER.reader();
  }

  /**
   * @return an {@link ObjectWriter} of the shared mapper.
   */
  public static ObjectWriter getWriter() {
    return MAPPER.writer();
  }

  /**
   * @return a mapper that only sees annotated fields and creators.
   */
  private static ObjectMapper newMapper() {
    ObjectMapper mapper = new ObjectMapper();

    /* Serialize Guava types correctly */
    mapper.registerModule(new GuavaModule());

    /* Don't automatically detect getters, explicit is better than implicit. */
    mapper.setVisibility(PropertyAccessor.GETTER, Visibility.NONE);
    mapper.setVisibility(PropertyAccessor.IS_GETTER, Visibility.NONE);
    mapper.setVisibility(PropertyAccessor.SETTER, Visibility.NONE);

    return mapper;
  }
}
