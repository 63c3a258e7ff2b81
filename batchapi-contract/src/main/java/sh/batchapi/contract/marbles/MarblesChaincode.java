// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.contract.marbles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import sh.batchapi.contract.AbstractBatchChaincode;
import sh.batchapi.contract.StressOperations;
import sh.batchapi.core.model.StressOptions;
import sh.batchapi.shim.ChaincodeStub;
import sh.batchapi.shim.Response;
import sh.batchapi.shim.StateIterator;

/**
 * Marbles chaincode with private data collections and the batch stress functions.
 *
 * <p>Marbles live in {@value #COLLECTION_MARBLES} together with a {@code color~name}
 * composite index; prices live in {@value #COLLECTION_PRIVATE_DETAILS}. Private
 * inputs arrive in the transient map so they never reach the transaction arguments:
 * <pre>
 * initMarble        transient "marble"        {"name","color","size","owner","price"}
 * transferMarble    transient "marble_owner"  {"name","owner"}
 * delete            transient "marble_delete" {"name"}
 * </pre>
 * The stress functions behave like their {@code objects} counterparts with the key
 * length fixed at {@value #KEY_LENGTH}.
 */
public final class MarblesChaincode extends AbstractBatchChaincode {

    public static final String NAME = "marbles";

    public static final String COLLECTION_MARBLES = "collectionMarbles";

    public static final String COLLECTION_PRIVATE_DETAILS = "collectionMarblePrivateDetails";

    public static final String COLOR_NAME_INDEX = "color~name";

    public static final int KEY_LENGTH = 7;

    private static final byte[] INDEX_VALUE = {0x00};

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public MarblesChaincode() {
        super();
    }

    public MarblesChaincode(final StressOperations stress) {
        super(stress);
    }

    @Override
    protected Response dispatch(final ChaincodeStub stub, final String function, final List<String> args) {
        return switch (function) {
            case "initMarble" -> initMarble(stub, args);
            case "readMarble" -> read(stub, args, COLLECTION_MARBLES, "Marble does not exist: ");
            case "readMarblePrivateDetails" ->
                    read(stub, args, COLLECTION_PRIVATE_DETAILS, "Marble private details does not exist: ");
            case "transferMarble" -> transferMarble(stub, args);
            case "delete" -> delete(stub, args);
            case "getMarblesByRange" -> getMarblesByRange(stub, args);
            case "queryMarblesByOwner" -> queryMarblesByOwner(stub, args);
            case "queryMarbles" -> queryMarbles(stub, args);
            case "putMarblesBatch" -> putPairs(stub, args);
            case "getMarblesBatch" -> getKeys(stub, args);
            case "putManyMarblesBatch" -> stress.put(stub, options(args));
            case "getManyMarblesBatch" -> stress.get(stub, options(args));
            case "delManyMarblesBatch" -> stress.delete(stub, options(args));
            default -> unknownFunction(function);
        };
    }

    private static StressOptions options(final List<String> args) {
        return StressOptions.parse(args, KEY_LENGTH, false);
    }

    private Response initMarble(final ChaincodeStub stub, final List<String> args) {
        if (!args.isEmpty()) {
            return Response.error(
                    "Incorrect number of arguments. Private marble data must be passed in transient map.");
        }
        final MarbleInput input;
        try {
            input = transientInput(stub, "marble", MarbleInput.class);
        } catch (InvalidInputException e) {
            return Response.error(e.getMessage());
        }
        if (isEmpty(input.name())) {
            return Response.error("name field must be a non-empty string");
        }
        if (isEmpty(input.color())) {
            return Response.error("color field must be a non-empty string");
        }
        if (input.size() <= 0) {
            return Response.error("size field must be a positive integer");
        }
        if (isEmpty(input.owner())) {
            return Response.error("owner field must be a non-empty string");
        }
        if (input.price() <= 0) {
            return Response.error("price field must be a positive integer");
        }

        if (stub.getPrivateData(COLLECTION_MARBLES, input.name()) != null) {
            log.debug("marble {} already exists", input.name());
            return Response.error("This marble already exists: " + input.name());
        }

        final Marble marble = Marble.of(input.name(), input.color(), input.size(), input.owner());
        stub.putPrivateData(COLLECTION_MARBLES, marble.name(), toJson(marble));
        stub.putPrivateData(
                COLLECTION_PRIVATE_DETAILS,
                marble.name(),
                toJson(MarblePrivateDetails.of(input.name(), input.price())));
        final String indexKey = stub.createCompositeKey(COLOR_NAME_INDEX, marble.color(), marble.name());
        stub.putPrivateData(COLLECTION_MARBLES, indexKey, INDEX_VALUE);
        return Response.success();
    }

    private static Response read(
            final ChaincodeStub stub, final List<String> args, final String collection, final String missing) {
        if (args.size() != 1) {
            return Response.error("Incorrect number of arguments. Expecting name of the marble to query");
        }
        final String name = args.get(0);
        final byte[] value = stub.getPrivateData(collection, name);
        if (value == null) {
            return Response.error(errorJson(missing + name));
        }
        return Response.success(value);
    }

    private Response transferMarble(final ChaincodeStub stub, final List<String> args) {
        if (!args.isEmpty()) {
            return Response.error(
                    "Incorrect number of arguments. Private marble data must be passed in transient map.");
        }
        final OwnerInput input;
        try {
            input = transientInput(stub, "marble_owner", OwnerInput.class);
        } catch (InvalidInputException e) {
            return Response.error(e.getMessage());
        }
        if (isEmpty(input.name())) {
            return Response.error("name field must be a non-empty string");
        }
        if (isEmpty(input.owner())) {
            return Response.error("owner field must be a non-empty string");
        }

        final Marble marble;
        try {
            marble = storedMarble(stub, input.name());
        } catch (InvalidInputException e) {
            return Response.error(e.getMessage());
        }
        stub.putPrivateData(COLLECTION_MARBLES, marble.name(), toJson(marble.withOwner(input.owner())));
        log.debug("marble {} transferred to {}", marble.name(), input.owner());
        return Response.success();
    }

    private Response delete(final ChaincodeStub stub, final List<String> args) {
        if (!args.isEmpty()) {
            return Response.error(
                    "Incorrect number of arguments. Private marble name must be passed in transient map.");
        }
        final DeleteInput input;
        final Marble marble;
        try {
            input = transientInput(stub, "marble_delete", DeleteInput.class);
            if (isEmpty(input.name())) {
                return Response.error("name field must be a non-empty string");
            }
            marble = storedMarble(stub, input.name());
        } catch (InvalidInputException e) {
            return Response.error(e.getMessage());
        }

        stub.delPrivateData(COLLECTION_MARBLES, input.name());
        stub.delPrivateData(COLLECTION_MARBLES, stub.createCompositeKey(COLOR_NAME_INDEX, marble.color(), marble.name()));
        stub.delPrivateData(COLLECTION_PRIVATE_DETAILS, input.name());
        return Response.success();
    }

    private static Response getMarblesByRange(final ChaincodeStub stub, final List<String> args) {
        if (args.size() < 2) {
            return Response.error("Incorrect number of arguments. Expecting 2");
        }
        try (StateIterator it = stub.getPrivateDataByRange(COLLECTION_MARBLES, args.get(0), args.get(1))) {
            return Response.success(records(it));
        }
    }

    private static Response queryMarblesByOwner(final ChaincodeStub stub, final List<String> args) {
        if (args.isEmpty()) {
            return Response.error("Incorrect number of arguments. Expecting 1");
        }
        final ObjectNode query = MAPPER.createObjectNode();
        query.putObject("selector")
                .put("docType", Marble.DOC_TYPE)
                .put("owner", args.get(0).toLowerCase(Locale.ROOT));
        return richQuery(stub, query.toString());
    }

    private static Response queryMarbles(final ChaincodeStub stub, final List<String> args) {
        if (args.isEmpty()) {
            return Response.error("Incorrect number of arguments. Expecting 1");
        }
        return richQuery(stub, args.get(0));
    }

    private static Response richQuery(final ChaincodeStub stub, final String query) {
        try (StateIterator it = stub.getPrivateDataQueryResult(COLLECTION_MARBLES, query)) {
            return Response.success(records(it));
        }
    }

    /**
     * Renders query results as {@code [{"Key":k,"Record":<json>},...]}.
     */
    private static String records(final StateIterator it) {
        final ArrayNode out = MAPPER.createArrayNode();
        it.forEachRemaining(kv -> {
            final ObjectNode entry = out.addObject();
            entry.put("Key", kv.key());
            entry.set("Record", recordNode(kv.valueAsString()));
        });
        return out.toString();
    }

    private static JsonNode recordNode(final String value) {
        try {
            return MAPPER.readTree(value);
        } catch (JsonProcessingException e) {
            // non-JSON values are listed as strings
            return TextNode.valueOf(value);
        }
    }

    private static Marble storedMarble(final ChaincodeStub stub, final String name) throws InvalidInputException {
        final byte[] value = stub.getPrivateData(COLLECTION_MARBLES, name);
        if (value == null) {
            throw new InvalidInputException("Marble does not exist: " + name);
        }
        final Marble marble;
        try {
            marble = MAPPER.readValue(value, Marble.class);
        } catch (IOException e) {
            throw new InvalidInputException("Failed to decode JSON of: " + new String(value, StandardCharsets.UTF_8));
        }
        if (marble == null) {
            throw new InvalidInputException("Failed to decode JSON of: null");
        }
        return marble;
    }

    private static <T> T transientInput(final ChaincodeStub stub, final String key, final Class<T> type)
            throws InvalidInputException {
        final byte[] raw = stub.getTransient().get(key);
        if (raw == null) {
            throw new InvalidInputException(key + " must be a key in the transient map");
        }
        if (raw.length == 0) {
            throw new InvalidInputException(key + " value in the transient map must be a non-empty JSON string");
        }
        final T input;
        try {
            input = MAPPER.readValue(raw, type);
        } catch (IOException e) {
            throw new InvalidInputException("Failed to decode JSON of: " + new String(raw, StandardCharsets.UTF_8));
        }
        if (input == null) {
            throw new InvalidInputException(key + " value in the transient map must be a JSON object");
        }
        return input;
    }

    private static byte[] toJson(final Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    private static String errorJson(final String message) {
        return MAPPER.createObjectNode().put("Error", message).toString();
    }

    private static boolean isEmpty(final String value) {
        return value == null || value.isEmpty();
    }

    /** Rejected transient input or stored record; becomes an error response. */
    private static final class InvalidInputException extends Exception {
        private static final long serialVersionUID = 1L;

        InvalidInputException(final String message) {
            super(message);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MarbleInput(
            @JsonProperty("name") String name,
            @JsonProperty("color") String color,
            @JsonProperty("size") int size,
            @JsonProperty("owner") String owner,
            @JsonProperty("price") int price) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OwnerInput(@JsonProperty("name") String name, @JsonProperty("owner") String owner) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DeleteInput(@JsonProperty("name") String name) {
    }
}
