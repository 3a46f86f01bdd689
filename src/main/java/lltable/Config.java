package lltable;

import java.io.*;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings, read from {@value #configFile} in the working directory if it exists.
 *
 * Each line has the form <pre>key = value</pre>, lines without " = " are ignored.
 */
public class Config {

	public static final String configFile = "lltable.ini";

	private static final Logger LOG = Logger.getLogger(Config.class.getName());

	/**
	 * Parent of all loggers in this library, kept here so that its level isn't lost
	 */
	private static final Logger ROOT_LOG = Logger.getLogger("lltable");

	private static final Map<String, String> defaults = new HashMap<String, String>(){{
		put("failOnConflict", "yes");
		put("skipWhitespace", "yes");
		put("logLevel", "INFO");
	}};

	private static final Map<String, String> config = new HashMap<>(defaults);

	/** Abort the table construction on an LL(1) conflict instead of logging it? */
	public static boolean failOnConflict(){
		return config.get("failOnConflict").equals("yes");
	}

	/** Skip spaces, tabs and line breaks in the parser input? */
	public static boolean skipWhitespace(){
		return config.get("skipWhitespace").equals("yes");
	}

	public static Level logLevel(){
		try {
			return Level.parse(config.get("logLevel"));
		} catch (IllegalArgumentException ex){
			LOG.warning("Unknown log level \"" + config.get("logLevel") + "\", using INFO");
			return Level.INFO;
		}
	}

	/**
	 * Reads the passed config lines, overriding the current values.
	 */
	static void load(BufferedReader reader) throws IOException {
		String line;
		while ((line = reader.readLine()) != null){
			if (line.contains(" = ")){
				String[] parts = line.split(" = ", 2);
				String key = parts[0].trim();
				if (config.containsKey(key)){
					config.put(key, parts[1].trim());
				} else {
					LOG.warning("Unknown config key \"" + key + "\"");
				}
			}
		}
		ROOT_LOG.setLevel(logLevel());
	}

	/**
	 * Resets every key to its default value.
	 */
	static void reset(){
		config.clear();
		config.putAll(defaults);
		ROOT_LOG.setLevel(logLevel());
	}

	private static void loadConfig(){
		File file = new File(configFile);
		if (!file.exists()){
			return;
		}
		try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
			load(reader);
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read " + configFile, e);
		}
	}

	static {
		ROOT_LOG.setLevel(logLevel());
		loadConfig();
	}
}
