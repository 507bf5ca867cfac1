package io.intellixity.avronames.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Loads extension implementations listed in {@code META-INF/avro-names.factories} resources.
 * <p>
 * Each resource is a Java Properties file keyed by SPI interface name:
 *
 * <pre>
 * io.intellixity.avronames.spi.verify.TypeVerificationStrategy=com.acme.NoDefaultNamespace,com.acme.Other
 * </pre>
 *
 * Values may be comma-separated; whitespace is ignored. The same class listed twice is instantiated once.
 */
public final class AvroNamesFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(AvroNamesFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/avro-names.factories";

  private AvroNamesFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = AvroNamesFactoriesLoader.class.getClassLoader();

    LinkedHashSet<String> implNames = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String v = read(url).getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    if (log.isDebugEnabled()) {
      log.debug("avronames.factories spi={} loaded={}", spiType.getName(), implNames);
    }
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
    }
    return p;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Class " + implName + " listed for SPI " + spiType.getName() + " not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalStateException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
