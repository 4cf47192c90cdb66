package slate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import slate.utils.Log;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Server settings. Sources in increasing precedence: config file (a YAML
 * mapping, or redis.conf style {@code key value} lines), standard input in the
 * {@code key value} form, then {@code --key value} command line arguments.
 * Every source goes through {@link #set(String, String)}, so all of them accept
 * the same keys and reject the same bad values.
 */
public class Config {
    public static final String DEFAULT_FILE = "slate.conf";

    public String version = "0.1.0";
    public String bind = "127.0.0.1";
    public int port = 6379;
    public String loglevel = "notice";
    public int statsInterval = 5; // seconds, 0 disables the stats line

    // Where the file settings came from, for the startup log
    private String source = "defaults";

    public String getSource() {
        return source;
    }

    /**
     * Builds the configuration from {@code main} arguments:
     * {@code [config-file] [--key value ...] [-]}. A trailing {@code -} reads
     * more settings from {@code stdin}.
     */
    public static Config fromCommandLine(String[] args, InputStream stdin) throws IOException {
        List<String> rest = new ArrayList<>(Arrays.asList(args));

        String path = DEFAULT_FILE;
        if (!rest.isEmpty() && !rest.get(0).startsWith("-")) {
            path = rest.remove(0);
        } else {
            Log.warn("No config file specified, using " + DEFAULT_FILE + ". Use: slate /path/to/slate.conf");
        }

        boolean useStdin = !rest.isEmpty() && rest.get(rest.size() - 1).equals("-");
        if (useStdin) {
            rest.remove(rest.size() - 1);
        }

        Config config = load(path);
        if (useStdin) {
            BufferedReader br = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            config.applyLines(br);
        }
        config.applyArgs(rest);
        return config;
    }

    /**
     * @throws IllegalArgumentException if the file sets a known key to a bad value
     */
    public static Config load(String filename) {
        File f = new File(filename);
        if (!f.exists()) {
            // Try looking for .yaml extension if .conf was passed
            if (filename.endsWith(".conf")) {
                File yamlFile = new File(filename.replace(".conf", ".yaml"));
                if (yamlFile.exists()) f = yamlFile;
            }
        }

        Config config = new Config();

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
            return config;
        }

        JsonNode root;
        try {
            root = new ObjectMapper(new YAMLFactory()).readTree(f);
        } catch (IOException e) {
            Log.warn("Failed to load config as YAML (" + e.getMessage() + "). Attempting legacy parse...");
            return loadLegacy(f);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            config.source = f.getPath(); // empty document
            return config;
        }
        if (!root.isObject()) {
            // redis.conf lines read as YAML come back as one plain scalar
            return loadLegacy(f);
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            config.set(field.getKey(), yamlValue(field.getValue()));
        }
        config.source = f.getPath();
        return config;
    }

    // Sequences (e.g. several bind addresses) become a space separated list.
    private static String yamlValue(JsonNode node) {
        if (node.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode item : node) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(item.asText());
            }
            return sb.toString();
        }
        return node.isNull() ? "" : node.asText();
    }

    private static Config loadLegacy(File f) {
        Config config = new Config();
        try (BufferedReader br = new BufferedReader(new FileReader(f, StandardCharsets.UTF_8))) {
            config.applyLines(br);
            config.source = f.getPath();
            Log.info("Loaded legacy config from " + f.getPath());
        } catch (IOException e) {
            Log.error("Error loading legacy config: " + e.getMessage());
        }
        return config;
    }

    /**
     * Applies redis.conf style lines: {@code key value}, {@code #} comments and
     * blank lines skipped, {@code ""} for an empty value.
     */
    public void applyLines(BufferedReader reader) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("\\s+", 2);
            String value = parts.length < 2 ? "" : parts[1].trim();
            if (value.equals("\"\"")) value = "";
            set(parts[0], value);
        }
    }

    /**
     * Applies {@code --key value} pairs. Stray values are logged and skipped.
     */
    public void applyArgs(List<String> args) {
        String key = null;
        for (String arg : args) {
            if (arg.startsWith("--")) {
                if (key != null) Log.warn("Missing value for argument: --" + key);
                key = arg.substring(2);
            } else if (key != null) {
                set(key, arg);
                key = null;
            } else {
                Log.warn("Invalid argument: " + arg);
            }
        }
        if (key != null) Log.warn("Missing value for argument: --" + key);
    }

    public void set(String key, String value) {
        switch (key.toLowerCase(Locale.ROOT)) {
            case "port":
                int p = parseInt(key, value);
                if (p < 0 || p > 65535) throw new IllegalArgumentException("invalid value for 'port': " + value);
                port = p;
                break;
            case "bind":
                // redis.conf allows several addresses; the first one is used
                String[] addresses = value.trim().split("\\s+");
                if (addresses[0].isEmpty()) throw new IllegalArgumentException("invalid value for 'bind': empty");
                bind = addresses[0];
                break;
            case "loglevel":
                Log.setLevel(value); // validates
                loglevel = value;
                break;
            case "stats-interval":
            case "statsinterval":
                int s = parseInt(key, value);
                if (s < 0) throw new IllegalArgumentException("invalid value for '" + key + "': " + value);
                statsInterval = s;
                break;
            default:
                Log.warn("Ignoring unsupported config option: " + key);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for '" + key + "': " + value, e);
        }
    }
}
