package pygen;

import org.json.JSONException;
import org.json.JSONObject;
import pygen.trans.TargetSupport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

// Options controlling Python code generation. Options are read from the
// "python" section of a JSON configuration object, e.g.
//
//   {"python": {"target_support": "optional", "line_width": 80, "indent": 4}}
//
// Every field is optional; missing fields keep their defaults.
public class PyGenOptions {
	public static final int DEFAULT_LINE_WIDTH = 80;
	public static final int DEFAULT_INDENT = 4;

	private static final String SECTION = "python";

	public TargetSupport targetSupport = TargetSupport.ENFORCED;
	public int lineWidth = DEFAULT_LINE_WIDTH;
	public int indent = DEFAULT_INDENT;

	public PyGenOptions() {}

	public PyGenOptions(TargetSupport targetSupport) {
		this.targetSupport = targetSupport;
	}

	public PyGenOptions(JSONObject config) throws PyGenOptionException {
		if (!config.has(SECTION)) {
			return;
		}
		JSONObject python;
		try {
			python = config.getJSONObject(SECTION);
		} catch (JSONException e) {
			throw new PyGenOptionException("\"" + SECTION + "\" must be an object");
		}

		if (python.has("target_support")) {
			String mode = python.optString("target_support", "");
			switch (mode) {
				case "enforced":
					targetSupport = TargetSupport.ENFORCED;
					break;
				case "optional":
					targetSupport = TargetSupport.OPTIONAL;
					break;
				default:
					throw new PyGenOptionException("unknown target_support \"" + mode +
							"\", expected \"enforced\" or \"optional\"");
			}
		}

		try {
			if (python.has("line_width")) {
				lineWidth = python.getInt("line_width");
			}
			if (python.has("indent")) {
				indent = python.getInt("indent");
			}
		} catch (JSONException e) {
			throw new PyGenOptionException(e.getMessage());
		}

		if (lineWidth <= 0) {
			throw new PyGenOptionException("line_width must be positive, got " + lineWidth);
		}
		if (indent <= 0) {
			throw new PyGenOptionException("indent must be positive, got " + indent);
		}
	}

	public static PyGenOptions fromFile(Path configFilePath) throws PyGenOptionException {
		String s;
		try {
			s = new String(Files.readAllBytes(configFilePath), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new PyGenOptionException("Error reading configuration file: " + ex.getMessage());
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new PyGenOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}
		return new PyGenOptions(config);
	}
}
