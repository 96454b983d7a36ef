package edu.harvard.hms.dbmi.avillach.inventory.exception;

import java.util.List;
import java.util.Map;

/**
 * Raised while loading declarative schema files. The result maps each offending file or dataset to the problems found in it.
 */
public class ValidationException extends Exception {

	private static final long serialVersionUID = -2558058901323272955L;

	private Map<String, List<String>> result;

	public ValidationException(Map<String, List<String>> result) {
		super("Schema definition files are invalid: " + result);
		this.setResult(result);
	}

	public Map<String, List<String>> getResult() {
		return result;
	}

	public void setResult(Map<String, List<String>> result) {
		this.result = result;
	}
}
