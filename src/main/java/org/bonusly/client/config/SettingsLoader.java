package org.bonusly.client.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.bonusly.client.exception.ConfigurationException;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.PropertiesPropertySourceLoader;
import org.springframework.boot.env.PropertySourceLoader;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.Environment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.env.SystemEnvironmentPropertySource;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.FileSystemResource;

/**
 * Builds {@link BonuslyProperties} outside a Spring application context.
 * This is the single place where the process environment and settings files are read.
 */
@Slf4j
@UtilityClass
public class SettingsLoader {

  public static final String PREFIX = "bonusly";
  public static final String DOTENV_FILE = ".env";

  private static final Pattern EXPORT = Pattern.compile("(?m)^[ \\t]*export[ \\t]+");

  /**
   * Binds settings from system properties and environment variables only.
   *
   * @return validated settings
   * @throws ConfigurationException if the token is missing or a setting is malformed
   */
  public static BonuslyProperties fromEnvironment() {
    return load(new StandardEnvironment());
  }

  /**
   * Binds settings from the environment, falling back to a {@code .properties}, {@code .env} or
   * {@code .yml} settings file for anything the environment does not define. A missing file is not an error;
   * the environment alone may still be enough.
   *
   * @param settingsFile the settings file to read
   * @return validated settings
   * @throws ConfigurationException if the file cannot be read or the result is invalid
   */
  public static BonuslyProperties fromSettingsFile(Path settingsFile) {
    StandardEnvironment environment = new StandardEnvironment();
    addSettingsFile(environment, settingsFile);
    return load(environment);
  }

  /**
   * Binds and validates the {@code bonusly.*} settings of an environment.
   *
   * @param environment the source of settings
   * @return validated settings
   * @throws ConfigurationException if binding fails or the result is invalid
   */
  public static BonuslyProperties load(Environment environment) {
    BonuslyProperties properties;
    try {
      properties = Binder.get(environment).bindOrCreate(PREFIX, BonuslyProperties.class);
    } catch (BindException e) {
      throw new ConfigurationException("Invalid Bonusly settings: " + e.getMessage(), e);
    }
    log.debug("Loaded Bonusly settings: {}", properties);
    return properties.validate();
  }

  /**
   * Binds settings from the environment, falling back to the {@code .env} file of the working
   * directory. The file holds {@code BONUSLY_*} variables, one {@code KEY=value} per line.
   *
   * @return validated settings
   * @throws ConfigurationException if the file cannot be read or the result is invalid
   */
  public static BonuslyProperties fromDotenv() {
    return fromSettingsFile(Path.of(DOTENV_FILE));
  }

  /**
   * Appends a settings file to the environment, after (and therefore below) the environment
   * variables. Keys of a non-YAML file bind either as {@code bonusly.page-size} or as
   * {@code BONUSLY_PAGE_SIZE}.
   */
  static void addSettingsFile(ConfigurableEnvironment environment, Path settingsFile) {
    if (!Files.exists(settingsFile)) {
      log.warn("Settings file {} not found, using the environment only", settingsFile.toAbsolutePath());
      return;
    }
    String fileName = settingsFile.getFileName().toString();
    String sourceName = "bonusly-settings:" + fileName;
    boolean yaml = fileName.endsWith(".yml") || fileName.endsWith(".yaml");
    PropertySourceLoader loader = yaml ? new YamlPropertySourceLoader() : new PropertiesPropertySourceLoader();
    try {
      MutablePropertySources propertySources = environment.getPropertySources();
      if (yaml) {
        loader.load(sourceName, new FileSystemResource(settingsFile)).forEach(propertySources::addLast);
      } else {
        String content = EXPORT.matcher(Files.readString(settingsFile, StandardCharsets.ISO_8859_1)).replaceAll("");
        Map<String, Object> variables = variables(loader.load(sourceName,
            new ByteArrayResource(content.getBytes(StandardCharsets.ISO_8859_1), settingsFile.toString())));
        propertySources.addLast(new MapPropertySource(sourceName, variables));
        propertySources.addLast(new SystemEnvironmentPropertySource(sourceName + "-systemEnvironment", variables));
      }
      log.info("Loaded Bonusly settings file {}", settingsFile.toAbsolutePath());
    } catch (IOException | RuntimeException e) {
      throw new ConfigurationException("Cannot read settings file " + settingsFile.toAbsolutePath(), e);
    }
  }

  /** Flattens key/value sources, dropping one pair of quotes around each value. */
  private static Map<String, Object> variables(List<PropertySource<?>> sources) {
    Map<String, Object> variables = new LinkedHashMap<>();
    for (PropertySource<?> source : sources) {
      if (source instanceof EnumerablePropertySource<?> enumerable) {
        for (String name : enumerable.getPropertyNames()) {
          String value = String.valueOf(enumerable.getProperty(name)).trim();
          value = value.startsWith("\"") ? StringUtils.unwrap(value, '"') : StringUtils.unwrap(value, '\'');
          variables.putIfAbsent(name, value);
        }
      }
    }
    return variables;
  }
}
