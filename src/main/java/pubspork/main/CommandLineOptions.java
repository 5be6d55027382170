package pubspork.main;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

import org.springframework.boot.ApplicationArguments;

/**
 * Reading {@code --name=value} options, shared by the run modes.
 */
final class CommandLineOptions {

    private CommandLineOptions() {
    }

    static String required(ApplicationArguments args, String name) {
        String value = optional(args, name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required option --" + name);
        }
        return value;
    }

    static String optional(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).trim().isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new IllegalArgumentException("Option --" + name + " given more than once: " + values);
        }
        return values.get(0).trim();
    }

    static LocalDate toDate(ApplicationArguments args, String name) {
        String value = optional(args, name);
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Option --" + name + " must be a yyyy-MM-dd date, not '" + value + "'", e);
        }
    }

    static Path toPath(String value) {
        return value == null ? null : Paths.get(value);
    }
}
