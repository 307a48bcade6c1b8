package com.example.orchestrator.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured form of a staff command.
 *
 * @param error set when the command was recognized but a required parameter is missing
 */
public record ParsedCommand(CommandType command, Map<String, String> params, String error) {

    public static final String TYPE = "type";
    public static final String FORMAT = "format";
    public static final String VEHICLE_ID = "vehicleId";
    public static final String STATUS = "status";
    public static final String FILTER = "filter";
    public static final String PERIOD = "period";
    public static final String FIELD = "field";
    public static final String VALUE = "value";
    public static final String DESCRIPTION = "description";
    public static final String PHONE = "phone";

    public ParsedCommand {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static ParsedCommand of(CommandType command, Map<String, String> params) {
        return new ParsedCommand(command, params, null);
    }

    public static ParsedCommand invalid(CommandType command, Map<String, String> params, String error) {
        return new ParsedCommand(command, params, error);
    }

    public static ParsedCommand unknown() {
        return new ParsedCommand(CommandType.UNKNOWN, Map.of(), null);
    }

    public String param(String key) {
        return params.get(key);
    }

    public boolean isValid() {
        return error == null;
    }
}
