/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import io.dataapi.driver.util.HttpConstants;
import io.dataapi.driver.values.ArrayValue;
import io.dataapi.driver.values.DocumentPath;
import io.dataapi.driver.values.DoubleValue;
import io.dataapi.driver.values.FieldValue;
import io.dataapi.driver.values.IntegerValue;
import io.dataapi.driver.values.JsonNullValue;
import io.dataapi.driver.values.JsonUtils;
import io.dataapi.driver.values.MapValue;
import io.dataapi.driver.values.StringValue;

/**
 * An in-memory stand-in for a Data API server used by the tests. It
 * implements the collection commands the driver sends with the same paging
 * limits a real server applies:
 * <ul>
 * <li>unsorted find pages hold {@link #PAGE_SIZE} documents</li>
 * <li>sorted finds return at most {@link #SORTED_FIND_LIMIT} documents and
 * are not paginated</li>
 * <li>countDocuments stops at {@link #COUNT_LIMIT}</li>
 * <li>updateMany and deleteMany process {@link #WRITE_BATCH} documents per
 * request</li>
 * </ul>
 * Filters support equality on dotted paths plus $eq, $ne, $gt, $gte, $lt,
 * $lte, $in, $nin, $exists, $and and $or. Updates support $set, $unset,
 * $inc and $setOnInsert. Dotted include projections select the whole top
 * level field.
 *
 * Failures can be injected: {@link #failNext} answers the next requests
 * with an HTTP status, {@link #setResponseDelay} delays every response.
 */
public class FakeDataAPIServer {

    public static final int PAGE_SIZE = 20;
    public static final int SORTED_FIND_LIMIT = 20;
    public static final int COUNT_LIMIT = 1000;
    public static final int WRITE_BATCH = 20;

    private final HttpServer server;
    private final ExecutorService executor;
    private final String token;

    /* "namespace/collection" to documents in insertion order */
    private final Map<String, List<MapValue>> collections =
        new HashMap<String, List<MapValue>>();

    private final List<String> commands = new ArrayList<String>();
    private final List<MapValue> commandBodies = new ArrayList<MapValue>();
    private final AtomicInteger requestCount = new AtomicInteger();

    private volatile int failStatus;
    private final AtomicInteger failRemaining = new AtomicInteger();
    private volatile long responseDelayMs;
    private volatile String lastUserAgent;

    public FakeDataAPIServer(String token) throws IOException {
        this.token = token;
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.createContext(HttpConstants.DEFAULT_API_PATH,
                             this::handle);
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop(0);
        executor.shutdownNow();
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    public String getEndpoint() {
        return "http://localhost:" + getPort();
    }

    /**
     * Answers the next {@code times} requests with the given HTTP status
     * and an empty body.
     */
    public void failNext(int status, int times) {
        failStatus = status;
        failRemaining.set(times);
    }

    public void setResponseDelay(long delayMs) {
        responseDelayMs = delayMs;
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    public String getLastUserAgent() {
        return lastUserAgent;
    }

    public synchronized List<String> getCommands() {
        return new ArrayList<String>(commands);
    }

    public synchronized MapValue getLastCommand() {
        return commandBodies.isEmpty() ? null :
            commandBodies.get(commandBodies.size() - 1);
    }

    /**
     * Clears every collection along with the recorded commands and any
     * injected failure.
     */
    public synchronized void reset() {
        collections.clear();
        commands.clear();
        commandBodies.clear();
        requestCount.set(0);
        failRemaining.set(0);
        responseDelayMs = 0;
    }

    public synchronized List<MapValue> getDocuments(String namespace,
                                                    String collection) {
        List<MapValue> docs = new ArrayList<MapValue>();
        for (MapValue doc : docs(namespace + "/" + collection)) {
            docs.add(doc.copy());
        }
        return docs;
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            requestCount.incrementAndGet();
            lastUserAgent = exchange.getRequestHeaders().getFirst(
                HttpConstants.USER_AGENT);
            byte[] body = readAll(exchange.getRequestBody());

            if (responseDelayMs > 0) {
                try {
                    Thread.sleep(responseDelayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
            if (failRemaining.getAndDecrement() > 0) {
                send(exchange, failStatus, "");
                return;
            }
            String auth = exchange.getRequestHeaders().getFirst(
                HttpConstants.TOKEN_HEADER);
            if (token != null && !token.equals(auth)) {
                send(exchange, 401, "{\"message\":\"bad token\"}");
                return;
            }

            String path = exchange.getRequestURI().getPath();
            String[] parts = path.substring(
                HttpConstants.DEFAULT_API_PATH.length()).split("/");
            if (parts.length < 3) {
                send(exchange, 404, "not found: " + path);
                return;
            }
            String key = parts[1] + "/" + parts[2];

            MapValue request = JsonUtils.createValueFromJson(
                new String(body, StandardCharsets.UTF_8)).asMap();
            Map.Entry<String, FieldValue> cmd =
                request.entrySet().iterator().next();
            MapValue response;
            synchronized (this) {
                commands.add(cmd.getKey());
                commandBodies.add(request);
                response = dispatch(key, cmd.getKey(), cmd.getValue().asMap());
            }
            send(exchange, 200, response.toJson());
        } catch (RuntimeException re) {
            send(exchange, 500, String.valueOf(re));
        } finally {
            exchange.close();
        }
    }

    private static byte[] readAll(InputStream in) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[4096];
        int n;
        while ((n = in.read(buf)) > 0) {
            out.write(buf, 0, n);
        }
        return out.toByteArray();
    }

    private static void send(HttpExchange exchange, int status, String body)
        throws IOException {

        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set(HttpConstants.CONTENT_TYPE,
                                          "application/json");
        exchange.sendResponseHeaders(status,
                                     bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    private List<MapValue> docs(String key) {
        List<MapValue> list = collections.get(key);
        if (list == null) {
            list = new ArrayList<MapValue>();
            collections.put(key, list);
        }
        return list;
    }

    /*
     * Commands
     */

    private MapValue dispatch(String key, String name, MapValue payload) {
        List<MapValue> coll = docs(key);
        switch (name) {
        case "insertOne":
            return insertOne(coll, payload);
        case "insertMany":
            return insertMany(coll, payload);
        case "find":
            return find(coll, payload);
        case "findOne":
            return findOne(coll, payload);
        case "countDocuments":
            return countDocuments(coll, payload);
        case "updateOne":
            return updateOne(coll, payload);
        case "updateMany":
            return updateMany(coll, payload);
        case "deleteOne":
            return deleteOne(coll, payload);
        case "deleteMany":
            return deleteMany(coll, payload);
        case "findOneAndUpdate":
            return findOneAndModify(coll, payload, false);
        case "findOneAndReplace":
            return findOneAndModify(coll, payload, true);
        case "findOneAndDelete":
            return findOneAndDelete(coll, payload);
        default:
            return errorResponse("NO_SUCH_COMMAND",
                                 "No such command: " + name);
        }
    }

    private MapValue insertOne(List<MapValue> coll, MapValue payload) {
        MapValue doc = map(payload, "document").copy();
        FieldValue id = ensureId(doc);
        if (indexOfId(coll, id) >= 0) {
            return errorResponse("DOCUMENT_ALREADY_EXISTS",
                                 "Document already exists with the given " +
                                 "_id: " + id.toJson());
        }
        coll.add(doc);
        MapValue response = new MapValue();
        response.put("status", new MapValue().put(
                         "insertedIds", new ArrayValue().add(id)));
        return response;
    }

    private MapValue insertMany(List<MapValue> coll, MapValue payload) {
        MapValue options = map(payload, "options");
        boolean ordered = options != null && options.contains("ordered") &&
            options.getBoolean("ordered");
        ArrayValue ids = new ArrayValue();
        ArrayValue errors = new ArrayValue();
        for (FieldValue val : payload.get("documents").asArray()) {
            MapValue doc = val.asMap().copy();
            FieldValue id = ensureId(doc);
            if (indexOfId(coll, id) >= 0) {
                errors.add(error("DOCUMENT_ALREADY_EXISTS",
                                 "Document already exists with the given " +
                                 "_id: " + id.toJson()));
                if (ordered) {
                    break;
                }
                continue;
            }
            coll.add(doc);
            ids.add(id);
        }
        MapValue response = new MapValue();
        response.put("status", new MapValue().put("insertedIds", ids));
        if (errors.size() > 0) {
            response.put("errors", errors);
        }
        return response;
    }

    private MapValue find(List<MapValue> coll, MapValue payload) {
        MapValue options = map(payload, "options");
        Integer skip = optInt(options, "skip");
        Integer limit = optInt(options, "limit");
        MapValue sort = map(payload, "sort");
        boolean sorted = sort != null && !sort.isEmpty();

        if (skip != null && !sorted) {
            return errorResponse("INVALID_FIND_OPTION",
                                 "skip requires a sort");
        }

        List<MapValue> matches = filter(coll, map(payload, "filter"));
        List<MapValue> page;
        String nextPageState = null;
        if (sorted) {
            sort(matches, sort);
            int from = Math.min(skip == null ? 0 : skip, matches.size());
            int max = Math.min(limit == null ? SORTED_FIND_LIMIT : limit,
                               SORTED_FIND_LIMIT);
            page = matches.subList(from, Math.min(from + max,
                                                  matches.size()));
        } else {
            String state = (options != null && options.contains("pageState") ?
                            options.getString("pageState") : null);
            int offset = (state == null ? 0 : Integer.parseInt(state));
            int total = (limit == null ? matches.size() :
                         Math.min(limit, matches.size()));
            int end = Math.min(offset + PAGE_SIZE, total);
            page = matches.subList(Math.min(offset, end), end);
            if (end < total) {
                nextPageState = String.valueOf(end);
            }
        }

        ArrayValue documents = new ArrayValue();
        MapValue projection = map(payload, "projection");
        for (MapValue doc : page) {
            documents.add(project(doc, projection));
        }
        MapValue data = new MapValue();
        data.put("documents", documents);
        data.put("nextPageState", nextPageState == null ?
                 JsonNullValue.getInstance() : new StringValue(nextPageState));
        return new MapValue().put("data", data);
    }

    private MapValue findOne(List<MapValue> coll, MapValue payload) {
        MapValue doc = first(coll, payload);
        return documentResponse(
            doc == null ? null : project(doc, map(payload, "projection")),
            new MapValue());
    }

    private MapValue countDocuments(List<MapValue> coll, MapValue payload) {
        int count = filter(coll, map(payload, "filter")).size();
        MapValue status = new MapValue();
        if (count > COUNT_LIMIT) {
            status.put("count", COUNT_LIMIT);
            status.put("moreData", true);
        } else {
            status.put("count", count);
        }
        return new MapValue().put("status", status);
    }

    private MapValue updateOne(List<MapValue> coll, MapValue payload) {
        MapValue update = map(payload, "update");
        MapValue doc = first(coll, payload);
        MapValue status = new MapValue();
        if (doc != null) {
            boolean modified = applyUpdate(doc, update, false);
            status.put("matchedCount", 1);
            status.put("modifiedCount", modified ? 1 : 0);
        } else {
            status.put("matchedCount", 0);
            status.put("modifiedCount", 0);
            if (upsert(payload)) {
                MapValue created = seed(map(payload, "filter"));
                applyUpdate(created, update, true);
                status.put("upsertedId", insertSeeded(coll, created));
            }
        }
        return new MapValue().put("status", status);
    }

    private MapValue updateMany(List<MapValue> coll, MapValue payload) {
        MapValue filter = map(payload, "filter");
        MapValue update = map(payload, "update");
        MapValue options = map(payload, "options");
        String state = (options != null && options.contains("pageState") ?
                        options.getString("pageState") : null);
        int index = (state == null ? 0 : Integer.parseInt(state));

        int matched = 0;
        int modified = 0;
        while (index < coll.size() && matched < WRITE_BATCH) {
            MapValue doc = coll.get(index++);
            if (matches(doc, filter)) {
                matched++;
                if (applyUpdate(doc, update, false)) {
                    modified++;
                }
            }
        }

        MapValue status = new MapValue();
        status.put("matchedCount", matched);
        status.put("modifiedCount", modified);
        boolean more = false;
        for (int i = index; i < coll.size(); i++) {
            if (matches(coll.get(i), filter)) {
                more = true;
                break;
            }
        }
        if (more) {
            status.put("moreData", true);
            status.put("nextPageState", String.valueOf(index));
        }
        if (matched == 0 && state == null && upsert(payload)) {
            MapValue created = seed(filter);
            applyUpdate(created, update, true);
            status.put("upsertedId", insertSeeded(coll, created));
        }
        return new MapValue().put("status", status);
    }

    private MapValue deleteOne(List<MapValue> coll, MapValue payload) {
        MapValue doc = first(coll, payload);
        if (doc != null) {
            coll.remove(doc);
        }
        return new MapValue().put(
            "status", new MapValue().put("deletedCount", doc == null ? 0 : 1));
    }

    private MapValue deleteMany(List<MapValue> coll, MapValue payload) {
        MapValue filter = map(payload, "filter");
        MapValue status = new MapValue();
        if (filter == null || filter.isEmpty()) {
            coll.clear();
            status.put("deletedCount", -1);
            return new MapValue().put("status", status);
        }
        int deleted = 0;
        Iterator<MapValue> iter = coll.iterator();
        while (iter.hasNext() && deleted < WRITE_BATCH) {
            if (matches(iter.next(), filter)) {
                iter.remove();
                deleted++;
            }
        }
        status.put("deletedCount", deleted);
        if (!filter(coll, filter).isEmpty()) {
            status.put("moreData", true);
        }
        return new MapValue().put("status", status);
    }

    private MapValue findOneAndModify(List<MapValue> coll,
                                      MapValue payload,
                                      boolean replace) {
        MapValue options = map(payload, "options");
        boolean after = options != null && options.contains("returnDocument") &&
            "after".equals(options.getString("returnDocument"));
        MapValue projection = map(payload, "projection");

        MapValue doc = first(coll, payload);
        MapValue status = new MapValue();
        MapValue result = null;
        if (doc != null) {
            MapValue before = doc.copy();
            boolean modified;
            if (replace) {
                MapValue replacement = map(payload, "replacement").copy();
                replacement.remove("_id");
                MapValue next = new MapValue();
                next.put("_id", doc.get("_id"));
                next.addAll(replacement);
                modified = !canonical(next).equals(canonical(doc));
                coll.set(coll.indexOf(doc), next);
                doc = next;
            } else {
                modified = applyUpdate(doc, map(payload, "update"), false);
            }
            status.put("matchedCount", 1);
            status.put("modifiedCount", modified ? 1 : 0);
            result = (after ? doc : before);
        } else {
            status.put("matchedCount", 0);
            status.put("modifiedCount", 0);
            if (upsert(payload)) {
                MapValue created;
                if (replace) {
                    created = map(payload, "replacement").copy();
                    if (!created.contains("_id")) {
                        FieldValue id = seed(map(payload, "filter")).get("_id");
                        if (id != null) {
                            created.put("_id", id);
                        }
                    }
                } else {
                    created = seed(map(payload, "filter"));
                    applyUpdate(created, map(payload, "update"), true);
                }
                status.put("upsertedId", insertSeeded(coll, created));
                if (after) {
                    result = created;
                }
            }
        }
        return documentResponse(
            result == null ? null : project(result, projection), status);
    }

    private MapValue findOneAndDelete(List<MapValue> coll, MapValue payload) {
        MapValue doc = first(coll, payload);
        if (doc != null) {
            coll.remove(doc);
        }
        return documentResponse(
            doc == null ? null : project(doc, map(payload, "projection")),
            new MapValue().put("deletedCount", doc == null ? 0 : 1));
    }

    /*
     * Helpers
     */

    private static MapValue documentResponse(MapValue doc, MapValue status) {
        MapValue data = new MapValue();
        data.put("document", doc == null ? JsonNullValue.getInstance() : doc);
        MapValue response = new MapValue();
        response.put("data", data);
        if (!status.isEmpty()) {
            response.put("status", status);
        }
        return response;
    }

    private static MapValue errorResponse(String code, String message) {
        return new MapValue().put("errors", new ArrayValue().add(
                                      error(code, message)));
    }

    private static MapValue error(String code, String message) {
        return new MapValue().put("errorCode", code).put("message", message);
    }

    private static MapValue map(MapValue payload, String name) {
        FieldValue val = (payload == null ? null : payload.get(name));
        return (val != null && val.isMap() ? val.asMap() : null);
    }

    private static Integer optInt(MapValue options, String name) {
        FieldValue val = (options == null ? null : options.get(name));
        return (val == null || !val.isNumeric() ? null : val.getInt());
    }

    private static boolean upsert(MapValue payload) {
        MapValue options = map(payload, "options");
        return options != null && options.contains("upsert") &&
            options.getBoolean("upsert");
    }

    private static String canonical(FieldValue value) {
        return JsonUtils.toCanonicalJson(value);
    }

    private static FieldValue ensureId(MapValue doc) {
        FieldValue id = doc.get("_id");
        if (id == null || id.isJsonNull()) {
            id = new StringValue(UUID.randomUUID().toString());
            doc.put("_id", id);
        }
        return id;
    }

    private static int indexOfId(List<MapValue> coll, FieldValue id) {
        String key = canonical(id);
        for (int i = 0; i < coll.size(); i++) {
            if (key.equals(canonical(coll.get(i).get("_id")))) {
                return i;
            }
        }
        return -1;
    }

    /* the id of the new document, generated if the document has none */
    private static FieldValue insertSeeded(List<MapValue> coll,
                                           MapValue created) {
        FieldValue id = ensureId(created);
        coll.add(created);
        return id;
    }

    /* top level equality conditions of a filter, the base of an upsert */
    private static MapValue seed(MapValue filter) {
        MapValue doc = new MapValue();
        if (filter == null) {
            return doc;
        }
        for (Map.Entry<String, FieldValue> e : filter.entrySet()) {
            String field = e.getKey();
            FieldValue cond = e.getValue();
            if (field.startsWith("$") || field.indexOf('.') >= 0) {
                continue;
            }
            if (isOperatorMap(cond)) {
                FieldValue eq = cond.asMap().get("$eq");
                if (eq != null) {
                    doc.put(field, eq);
                }
                continue;
            }
            doc.put(field, cond);
        }
        return doc;
    }

    private MapValue first(List<MapValue> coll, MapValue payload) {
        List<MapValue> matches = filter(coll, map(payload, "filter"));
        MapValue sort = map(payload, "sort");
        if (sort != null && !sort.isEmpty()) {
            sort(matches, sort);
        }
        return matches.isEmpty() ? null : matches.get(0);
    }

    private static List<MapValue> filter(List<MapValue> coll,
                                         MapValue filter) {
        List<MapValue> result = new ArrayList<MapValue>();
        for (MapValue doc : coll) {
            if (matches(doc, filter)) {
                result.add(doc);
            }
        }
        return result;
    }

    static boolean matches(MapValue doc, MapValue filter) {
        if (filter == null) {
            return true;
        }
        for (Map.Entry<String, FieldValue> e : filter.entrySet()) {
            String field = e.getKey();
            FieldValue cond = e.getValue();
            if ("$and".equals(field)) {
                for (FieldValue sub : cond.asArray()) {
                    if (!matches(doc, sub.asMap())) {
                        return false;
                    }
                }
            } else if ("$or".equals(field)) {
                boolean any = false;
                for (FieldValue sub : cond.asArray()) {
                    if (matches(doc, sub.asMap())) {
                        any = true;
                        break;
                    }
                }
                if (!any) {
                    return false;
                }
            } else {
                List<FieldValue> values = resolve(doc, field);
                if (isOperatorMap(cond)) {
                    for (Map.Entry<String, FieldValue> op :
                             cond.asMap().entrySet()) {
                        if (!test(values, op.getKey(), op.getValue())) {
                            return false;
                        }
                    }
                } else if (!test(values, "$eq", cond)) {
                    return false;
                }
            }
        }
        return true;
    }

    /* the values at a path, an array counted both whole and by element */
    private static List<FieldValue> resolve(MapValue doc, String field) {
        List<FieldValue> values = new ArrayList<FieldValue>(
            DocumentPath.parse(field).extract(doc));
        FieldValue direct = doc.get(field);
        if (direct != null && direct.isArray()) {
            values.add(direct);
        }
        return values;
    }

    private static boolean isOperatorMap(FieldValue cond) {
        if (!cond.isMap() || cond.asMap().isEmpty()) {
            return false;
        }
        for (String key : cond.asMap().getMap().keySet()) {
            if (!key.startsWith("$")) {
                return false;
            }
        }
        return true;
    }

    private static boolean test(List<FieldValue> values,
                                String op,
                                FieldValue arg) {
        switch (op) {
        case "$eq":
            return containsEqual(values, arg);
        case "$ne":
            return !containsEqual(values, arg);
        case "$in":
            for (FieldValue candidate : arg.asArray()) {
                if (containsEqual(values, candidate)) {
                    return true;
                }
            }
            return false;
        case "$nin":
            for (FieldValue candidate : arg.asArray()) {
                if (containsEqual(values, candidate)) {
                    return false;
                }
            }
            return true;
        case "$exists":
            return values.isEmpty() != arg.getBoolean();
        case "$gt":
        case "$gte":
        case "$lt":
        case "$lte":
            for (FieldValue val : values) {
                if (!comparable(val, arg)) {
                    continue;
                }
                int cmp = compareValues(val, arg);
                if (("$gt".equals(op) && cmp > 0) ||
                    ("$gte".equals(op) && cmp >= 0) ||
                    ("$lt".equals(op) && cmp < 0) ||
                    ("$lte".equals(op) && cmp <= 0)) {
                    return true;
                }
            }
            return false;
        default:
            throw new IllegalArgumentException("Unsupported operator: " + op);
        }
    }

    private static boolean containsEqual(List<FieldValue> values,
                                         FieldValue arg) {
        String key = canonical(arg);
        for (FieldValue val : values) {
            if (key.equals(canonical(val))) {
                return true;
            }
        }
        return false;
    }

    private static boolean comparable(FieldValue a, FieldValue b) {
        return (a.isNumeric() && b.isNumeric()) ||
            a.getType() == b.getType();
    }

    private static int rank(FieldValue val) {
        if (val.isJsonNull()) {
            return 0;
        }
        if (val.isNumeric()) {
            return 1;
        }
        if (val.isString()) {
            return 2;
        }
        if (val.isMap()) {
            return 3;
        }
        if (val.isArray()) {
            return 4;
        }
        if (val.isBoolean()) {
            return 5;
        }
        return 6;
    }

    private static int compareValues(FieldValue a, FieldValue b) {
        int ra = rank(a);
        int rb = rank(b);
        if (ra != rb) {
            return Integer.compare(ra, rb);
        }
        if (a.isJsonNull()) {
            return 0;
        }
        if (a.isMap() || a.isArray()) {
            return canonical(a).compareTo(canonical(b));
        }
        return a.compareTo(b);
    }

    /* missing values sort first */
    private static void sort(List<MapValue> docs, MapValue sort) {
        final List<String> paths = new ArrayList<String>();
        final List<Integer> directions = new ArrayList<Integer>();
        for (Map.Entry<String, FieldValue> e : sort.entrySet()) {
            paths.add(e.getKey());
            directions.add(e.getValue().getInt() < 0 ? -1 : 1);
        }
        Collections.sort(docs, new Comparator<MapValue>() {
            @Override
            public int compare(MapValue d1, MapValue d2) {
                for (int i = 0; i < paths.size(); i++) {
                    DocumentPath path = DocumentPath.parse(paths.get(i));
                    List<FieldValue> v1 = path.extract(d1);
                    List<FieldValue> v2 = path.extract(d2);
                    int cmp;
                    if (v1.isEmpty() || v2.isEmpty()) {
                        cmp = Boolean.compare(!v1.isEmpty(), !v2.isEmpty());
                    } else {
                        cmp = compareValues(v1.get(0), v2.get(0));
                    }
                    if (cmp != 0) {
                        return cmp * directions.get(i);
                    }
                }
                return 0;
            }
        });
    }

    /* returns true if the document changed */
    private static boolean applyUpdate(MapValue doc,
                                       MapValue update,
                                       boolean inserting) {
        String before = canonical(doc);
        for (Map.Entry<String, FieldValue> e : update.entrySet()) {
            String op = e.getKey();
            MapValue args = e.getValue().asMap();
            for (Map.Entry<String, FieldValue> arg : args.entrySet()) {
                String path = arg.getKey();
                FieldValue val = arg.getValue();
                switch (op) {
                case "$set":
                    set(doc, path, val);
                    break;
                case "$setOnInsert":
                    if (inserting) {
                        set(doc, path, val);
                    }
                    break;
                case "$unset":
                    unset(doc, path);
                    break;
                case "$inc":
                    FieldValue current = get(doc, path);
                    if (current == null) {
                        set(doc, path, val);
                    } else if (current.isInteger() && val.isInteger()) {
                        set(doc, path, new IntegerValue(
                                current.getInt() + val.getInt()));
                    } else {
                        set(doc, path, new DoubleValue(
                                current.castAsDouble() + val.castAsDouble()));
                    }
                    break;
                default:
                    throw new IllegalArgumentException(
                        "Unsupported update operator: " + op);
                }
            }
        }
        return !before.equals(canonical(doc));
    }

    private static FieldValue get(MapValue doc, String path) {
        String[] segments = path.split("\\.");
        FieldValue current = doc;
        for (String segment : segments) {
            if (current == null || !current.isMap()) {
                return null;
            }
            current = current.asMap().get(segment);
        }
        return current;
    }

    private static void set(MapValue doc, String path, FieldValue val) {
        String[] segments = path.split("\\.");
        MapValue current = doc;
        for (int i = 0; i < segments.length - 1; i++) {
            FieldValue child = current.get(segments[i]);
            if (child == null || !child.isMap()) {
                child = new MapValue();
                current.put(segments[i], child);
            }
            current = child.asMap();
        }
        current.put(segments[segments.length - 1], val);
    }

    private static void unset(MapValue doc, String path) {
        String[] segments = path.split("\\.");
        MapValue current = doc;
        for (int i = 0; i < segments.length - 1; i++) {
            FieldValue child = current.get(segments[i]);
            if (child == null || !child.isMap()) {
                return;
            }
            current = child.asMap();
        }
        current.remove(segments[segments.length - 1]);
    }

    private static MapValue project(MapValue doc, MapValue projection) {
        MapValue copy = doc.copy();
        if (projection == null || projection.isEmpty()) {
            return copy;
        }
        boolean include = false;
        boolean keepId = true;
        for (Map.Entry<String, FieldValue> e : projection.entrySet()) {
            boolean flag = truthy(e.getValue());
            if ("_id".equals(e.getKey())) {
                keepId = flag;
            } else if (flag) {
                include = true;
            }
        }
        if (include) {
            MapValue result = new MapValue();
            if (keepId && copy.contains("_id")) {
                result.put("_id", copy.get("_id"));
            }
            for (Map.Entry<String, FieldValue> e : projection.entrySet()) {
                String top = e.getKey().split("\\.")[0];
                if (!"_id".equals(top) && truthy(e.getValue()) &&
                    copy.contains(top)) {
                    result.put(top, copy.get(top));
                }
            }
            return result;
        }
        for (Map.Entry<String, FieldValue> e : projection.entrySet()) {
            if (!truthy(e.getValue())) {
                unset(copy, e.getKey());
            }
        }
        return copy;
    }

    private static boolean truthy(FieldValue val) {
        if (val.isBoolean()) {
            return val.getBoolean();
        }
        return val.isNumeric() && val.castAsDouble() != 0;
    }
}
