package com.questrail.rendezvous.key;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * EndpointName
 * -----------------------------------------------------------------------------
 * Parsed identity of a transfer endpoint.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   name    := ( "/" segment )+
 *   segment := "job:" ident
 *            | "replica:" number
 *            | "task:" number
 *            | "device:" ident ":" ( number | "*" )
 *            | ( "cpu" | "gpu" ) ":" ( number | "*" )      legacy device form
 * </pre>
 *
 * <p>Every segment is optional but each may appear at most once, and at least
 * one segment is required. Example: {@code /job:worker/replica:0/task:1/device:CPU:0}.</p>
 *
 * <p>The original text is kept as {@link #name()}; keys embed it verbatim.</p>
 */
public final class EndpointName
{
    private static final Pattern IDENT = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");
    private static final Pattern NUMBER = Pattern.compile("[0-9]+");

    private final String name;
    private final String job;
    private final Integer replica;
    private final Integer task;
    private final String deviceType;
    private final String deviceId;

    private EndpointName(String name, String job, Integer replica, Integer task,
                         String deviceType, String deviceId) {
        this.name = name;
        this.job = job;
        this.replica = replica;
        this.task = task;
        this.deviceType = deviceType;
        this.deviceId = deviceId;
    }

    /**
     * Parses {@code text}, returning empty if it is not a well-formed endpoint
     * name.
     */
    public static Optional<EndpointName> parse(String text) {
        if (text == null || text.length() < 2 || text.charAt(0) != '/') {
            return Optional.empty();
        }

        String job = null;
        Integer replica = null;
        Integer task = null;
        String deviceType = null;
        String deviceId = null;

        String[] segments = text.substring(1).split("/", -1);
        for (String segment : segments) {
            int colon = segment.indexOf(':');
            if (colon <= 0 || colon == segment.length() - 1) {
                return Optional.empty();
            }
            String field = segment.substring(0, colon);
            String value = segment.substring(colon + 1);

            switch (field) {
                case "job" -> {
                    if (job != null || !IDENT.matcher(value).matches()) {
                        return Optional.empty();
                    }
                    job = value;
                }
                case "replica" -> {
                    if (replica != null || !isSmallNumber(value)) {
                        return Optional.empty();
                    }
                    replica = Integer.parseInt(value);
                }
                case "task" -> {
                    if (task != null || !isSmallNumber(value)) {
                        return Optional.empty();
                    }
                    task = Integer.parseInt(value);
                }
                case "device" -> {
                    int idColon = value.lastIndexOf(':');
                    if (deviceType != null || idColon <= 0) {
                        return Optional.empty();
                    }
                    String type = value.substring(0, idColon);
                    String id = value.substring(idColon + 1);
                    if (!IDENT.matcher(type).matches() || !isDeviceId(id)) {
                        return Optional.empty();
                    }
                    deviceType = type;
                    deviceId = id;
                }
                case "cpu", "gpu" -> {
                    if (deviceType != null || !isDeviceId(value)) {
                        return Optional.empty();
                    }
                    deviceType = field.toUpperCase();
                    deviceId = value;
                }
                default -> {
                    return Optional.empty();
                }
            }
        }

        return Optional.of(new EndpointName(text, job, replica, task, deviceType, deviceId));
    }

    /**
     * Parses {@code text}.
     *
     * @throws IllegalArgumentException if it is not a well-formed endpoint name
     */
    public static EndpointName of(String text) {
        return parse(text).orElseThrow(
                () -> new IllegalArgumentException("Malformed endpoint name: " + text));
    }

    private static boolean isSmallNumber(String value) {
        return NUMBER.matcher(value).matches() && value.length() <= 9;
    }

    private static boolean isDeviceId(String value) {
        return "*".equals(value) || isSmallNumber(value);
    }

    public String name() {
        return name;
    }

    public Optional<String> job() {
        return Optional.ofNullable(job);
    }

    public OptionalInt replica() {
        return replica == null ? OptionalInt.empty() : OptionalInt.of(replica);
    }

    public OptionalInt task() {
        return task == null ? OptionalInt.empty() : OptionalInt.of(task);
    }

    public Optional<String> deviceType() {
        return Optional.ofNullable(deviceType);
    }

    public Optional<String> deviceId() {
        return Optional.ofNullable(deviceId);
    }

    /**
     * The process-level part of this name ({@code /job:x/replica:r/task:t}),
     * without the device. Endpoints that share a task address live in the
     * same process.
     */
    public String taskAddress() {
        StringBuilder sb = new StringBuilder();
        if (job != null) {
            sb.append("/job:").append(job);
        }
        if (replica != null) {
            sb.append("/replica:").append(replica);
        }
        if (task != null) {
            sb.append("/task:").append(task);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof EndpointName other && name.equals(other.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }

    static String requireWellFormed(String text, String what) {
        Objects.requireNonNull(text, what);
        if (parse(text).isEmpty()) {
            throw new MalformedKeyException("Malformed " + what + " endpoint name: " + text);
        }
        return text;
    }
}
