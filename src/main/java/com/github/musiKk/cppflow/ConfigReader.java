package com.github.musiKk.cppflow;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

import com.github.musiKk.cppflow.parser.TopLevelMode;

public class ConfigReader {

    private static final Logger LOG = Logger.getLogger(ConfigReader.class.getName());

    static final String DEFAULTS_RESOURCE = "/cppflow.properties";
    static final Path LOCAL_CONFIG = Path.of("cppflow.cfg");

    /** Built-in defaults, overridden by {@code cppflow.cfg} in the working directory when it exists. */
    static Config readConfig() {
        var properties = readDefaults();
        if (Files.isRegularFile(LOCAL_CONFIG)) {
            load(properties, LOCAL_CONFIG);
        }
        return Config.from(properties);
    }

    /** Built-in defaults, overridden by {@code file}, which must exist. */
    static Config readConfig(Path file) {
        var properties = readDefaults();
        load(properties, file);
        return Config.from(properties);
    }

    static Properties readDefaults() {
        var properties = new Properties();
        try (InputStream in = ConfigReader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                LOG.warning("missing " + DEFAULTS_RESOURCE + ", using compiled-in defaults");
            } else {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return properties;
    }

    private static void load(Properties properties, Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
            LOG.config(() -> "loaded configuration from " + file.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read configuration " + file, e);
        }
    }

    static class Config {
        TopLevelMode topLevelMode = TopLevelMode.STRICT_MAIN;
        boolean optimize = true;
        Set<String> ioIdentifiers = new LinkedHashSet<>();
        String startLabel = "start";
        String endLabel = "end";
        String yesLabel = "yes";
        String noLabel = "no";

        static Config from(Properties properties) {
            var config = new Config();
            config.topLevelMode = TopLevelMode.fromConfig(properties.getProperty("topLevel", "strict"));
            config.optimize = Boolean.parseBoolean(properties.getProperty("optimize", "true").strip());
            Arrays.stream(properties.getProperty("ioIdentifiers", "cin,cout,cerr,clog,printf,scanf,puts,gets,getline,getchar,putchar").split(","))
                    .map(String::strip)
                    .filter(s -> !s.isEmpty())
                    .forEach(config.ioIdentifiers::add);
            config.startLabel = properties.getProperty("startLabel", config.startLabel);
            config.endLabel = properties.getProperty("endLabel", config.endLabel);
            config.yesLabel = properties.getProperty("yesLabel", config.yesLabel);
            config.noLabel = properties.getProperty("noLabel", config.noLabel);
            return config;
        }

        public void applyConfig(ConfigTarget ct) {
            ct.setTopLevelMode(topLevelMode);
            ct.setOptimize(optimize);
            ct.setIoIdentifiers(Set.copyOf(ioIdentifiers));
            ct.setStartLabel(startLabel);
            ct.setEndLabel(endLabel);
            ct.setYesLabel(yesLabel);
            ct.setNoLabel(noLabel);
        }
    }

    interface ConfigTarget {
        void setTopLevelMode(TopLevelMode topLevelMode);
        void setOptimize(boolean optimize);
        void setIoIdentifiers(Set<String> ioIdentifiers);
        void setStartLabel(String startLabel);
        void setEndLabel(String endLabel);
        void setYesLabel(String yesLabel);
        void setNoLabel(String noLabel);
    }

}
