package org.autotile.core.io;

import org.autotile.core.model.config.PaintSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

public final class LocalPaintConfigLoader {
    private static final Path DEFAULT_CONFIG_PATH = Paths.get("local", "autotile.local.properties");

    private LocalPaintConfigLoader() {
    }

    public static void apply(PaintSettings settings) {
        apply(settings, resolvePath());
    }

    public static void apply(PaintSettings settings, Path path) {
        if (!Files.exists(path)) {
            return;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read local paint config: " + path.toAbsolutePath(), e);
        }

        String seed = pick(props.getProperty("paint.seed"));
        if (seed != null) {
            settings.seed = parseLong("paint.seed", seed);
        }
        String validate = pick(props.getProperty("paint.validateSeams"));
        if (validate != null) {
            settings.validateSeams = Boolean.parseBoolean(validate);
        }
        String maxFill = pick(props.getProperty("paint.maxFillCells"));
        if (maxFill != null) {
            settings.maxFillCells = parsePositiveInt("paint.maxFillCells", maxFill);
        }
    }

    private static Path resolvePath() {
        String override = pick(
                System.getProperty("autotile.config.path"),
                System.getenv("AUTOTILE_CONFIG_PATH")
        );
        if (override == null) {
            return DEFAULT_CONFIG_PATH;
        }
        return Paths.get(override);
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Bad value for " + key + ": " + value, e);
        }
    }

    private static int parsePositiveInt(String key, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Bad value for " + key + ": " + value, e);
        }
        if (parsed <= 0) {
            throw new IllegalStateException("Bad value for " + key + ": " + value + " (must be > 0)");
        }
        return parsed;
    }

    private static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return null;
    }
}
