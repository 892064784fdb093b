package pyken;

import org.json.JSONObject;

// Wraps the "build" section of the JSON configuration file:
//
//   {"build": {"output_dir": "out", "extension": ".ak"}}
//
// Both members are optional.
public class PyKenBuildOptions {
	public static final String DEFAULT_EXTENSION = ".ak";

	public String outputDir;
	public String extension;

	public PyKenBuildOptions() {
		this.outputDir = null;
		this.extension = DEFAULT_EXTENSION;
	}

	public PyKenBuildOptions(JSONObject config) {
		this();
		if (config.has("output_dir")) {
			this.outputDir = config.getString("output_dir");
		}
		if (config.has("extension")) {
			this.extension = config.getString("extension");
		}
	}
}
