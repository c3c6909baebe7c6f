package com.sailfish.servicekit.task;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts {@link TaskMessage}s to and from the bytes a backend transports.
 */
public class TaskCodec {

    private final ObjectMapper mapper;

    public TaskCodec() {
        this(new ObjectMapper().findAndRegisterModules());
    }

    public TaskCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    /**
     * Builds a message for {@code function}, turning each argument into a JSON tree.
     *
     * @throws TaskException if an argument cannot be serialized.
     */
    public TaskMessage toMessage(TaskFunction function, Object[] args) throws TaskException {
        List<JsonNode> trees = new ArrayList<>(args.length);
        for (int i = 0; i < args.length; i++) {
            try {
                trees.add(args[i] == null ? mapper.getNodeFactory().nullNode() : mapper.valueToTree(args[i]));
            } catch (IllegalArgumentException e) {
                throw new TaskException("Argument " + i + " of '" + function.getId() + "' cannot be serialized", e);
            }
        }
        return new TaskMessage(function.getId(), trees);
    }

    public byte[] encode(TaskMessage message) throws TaskException {
        try {
            return mapper.writeValueAsBytes(message);
        } catch (IOException e) {
            throw new TaskException("Failed to encode " + message, e);
        }
    }

    /**
     * @throws TaskException if the bytes are not a valid message.
     */
    public TaskMessage decode(byte[] payload) throws TaskException {
        if (payload == null || payload.length == 0) {
            throw new TaskException("Empty task message");
        }
        try {
            return mapper.readValue(payload, TaskMessage.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new TaskException("Malformed task message: " + e.getMessage(), e);
        }
    }

    /**
     * Converts the message arguments to the generic parameter types of {@code function}.
     *
     * @throws TaskException if the count differs or an argument does not fit its parameter type.
     */
    public Object[] toArguments(TaskFunction function, TaskMessage message) throws TaskException {
        List<Type> types = function.getGenericArgumentTypes();
        List<JsonNode> trees = message.getArgs();
        if (types.size() != trees.size()) {
            throw new TaskException("Task '" + function.getId() + "' expects " + types.size()
                    + " argument(s) but message carries " + trees.size());
        }
        Object[] args = new Object[types.size()];
        for (int i = 0; i < args.length; i++) {
            JavaType javaType = mapper.getTypeFactory().constructType(types.get(i));
            JsonNode tree = trees.get(i);
            // Jackson coerces null to the primitive default, so check before converting
            if ((tree == null || tree.isNull()) && javaType.isPrimitive()) {
                throw new TaskException("Argument " + i + " of '" + function.getId() + "' is null for primitive "
                        + javaType.toCanonical());
            }
            try {
                args[i] = mapper.convertValue(tree, javaType);
            } catch (IllegalArgumentException e) {
                throw new TaskException("Argument " + i + " of '" + function.getId() + "' does not match "
                        + javaType.toCanonical(), e);
            }
        }
        return args;
    }
}
