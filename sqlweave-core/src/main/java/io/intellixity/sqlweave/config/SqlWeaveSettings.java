package io.intellixity.sqlweave.config;

import io.intellixity.sqlweave.sql.PlaceholderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Enumeration;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings read from {@code META-INF/sqlweave.properties} resources on the classpath.
 *
 * <pre>
 * sqlweave.placeholder=dollar_sequential
 * </pre>
 *
 * Resources are applied in classpath order, later ones overriding earlier ones. A system property with the
 * same key wins over all resources.
 */
public record SqlWeaveSettings(PlaceholderKind placeholderKind) {
  public static final String RESOURCE = "META-INF/sqlweave.properties";
  public static final String PLACEHOLDER_KEY = "sqlweave.placeholder";

  private static final Logger log = LoggerFactory.getLogger(SqlWeaveSettings.class);

  public SqlWeaveSettings {
    placeholderKind = (placeholderKind == null) ? PlaceholderKind.QUESTION_MARK : placeholderKind;
  }

  public static SqlWeaveSettings defaults() {
    return new SqlWeaveSettings(PlaceholderKind.QUESTION_MARK);
  }

  public static SqlWeaveSettings load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static SqlWeaveSettings load(ClassLoader cl) {
    if (cl == null) cl = SqlWeaveSettings.class.getClassLoader();

    Properties merged = new Properties();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new RuntimeException("Failed to enumerate " + RESOURCE, e);
    }

    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new RuntimeException("Failed to load " + RESOURCE + " from " + url, e);
      }
      log.debug("sqlweave.settings resource={} keys={}", url, p.stringPropertyNames());
      merged.putAll(p);
    }

    String override = System.getProperty(PLACEHOLDER_KEY);
    if (override != null && !override.isBlank()) merged.setProperty(PLACEHOLDER_KEY, override);
    return fromProperties(merged);
  }

  public static SqlWeaveSettings fromProperties(Properties p) {
    Objects.requireNonNull(p, "properties");
    String v = p.getProperty(PLACEHOLDER_KEY);
    if (v == null || v.isBlank()) return defaults();
    return new SqlWeaveSettings(PlaceholderKind.fromId(v));
  }
}
