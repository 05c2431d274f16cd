package io.intellixity.biodb.persistence.util;

import io.intellixity.biodb.persistence.error.ConfigException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Discovers extension implementations listed in {@code META-INF/biodb.factories}.\n
 *
 * Every resource with that name is a Java Properties file keyed by the extension interface:\n
 *
 * <pre>
 * io.intellixity.biodb.persistence.codec.CodecProvider=com.acme.GenbankCodecProvider
 * io.intellixity.biodb.persistence.jdbc.dialect.DialectProvider=com.acme.H2DialectProvider
 * </pre>
 *
 * Values are comma-separated class names with public no-arg constructors. A class listed by
 * several resources is instantiated once.\n
 */
public final class BiodbFactoriesLoader {
  public static final String RESOURCE = "META-INF/biodb.factories";

  private BiodbFactoriesLoader() {}

  public static <T> List<T> load(Class<T> extensionType) {
    return load(extensionType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> extensionType, ClassLoader cl) {
    Objects.requireNonNull(extensionType, "extensionType");
    ClassLoader loader = cl == null ? BiodbFactoriesLoader.class.getClassLoader() : cl;

    Set<String> classNames = new LinkedHashSet<>();
    for (URL url : resources(loader)) {
      String listed = read(url).getProperty(extensionType.getName());
      if (listed == null) continue;
      for (String part : listed.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) classNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(classNames.size());
    for (String name : classNames) out.add(instantiate(name, extensionType, loader));
    return out;
  }

  private static List<URL> resources(ClassLoader loader) {
    try {
      List<URL> urls = new ArrayList<>();
      Enumeration<URL> e = loader.getResources(RESOURCE);
      while (e.hasMoreElements()) urls.add(e.nextElement());
      return urls;
    } catch (IOException e) {
      throw new ConfigException("Failed to enumerate " + RESOURCE, null, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
      return p;
    } catch (IOException e) {
      throw new ConfigException("Failed to read " + url, null, e);
    }
  }

  private static <T> T instantiate(String className, Class<T> extensionType, ClassLoader loader) {
    Class<?> raw;
    try {
      raw = Class.forName(className, true, loader);
    } catch (ClassNotFoundException e) {
      throw new ConfigException("Listed class not found: " + className, null, e);
    }
    if (!extensionType.isAssignableFrom(raw)) {
      throw new ConfigException(className + " does not implement " + extensionType.getName());
    }
    try {
      return extensionType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new ConfigException("Failed to instantiate " + className, null, e);
    }
  }
}
