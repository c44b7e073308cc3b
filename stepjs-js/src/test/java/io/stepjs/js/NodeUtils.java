package io.stepjs.js;

import io.stepjs.parser.Node;
import net.minidev.json.JSONValue;
import org.junit.jupiter.api.Assertions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@SuppressWarnings("unchecked")
public class NodeUtils {

    static final Logger logger = LoggerFactory.getLogger(NodeUtils.class);

    public static <T> T fromJson(String s) {
        return (T) JSONValue.parse(s);
    }

    public static String toJson(Object o) {
        return JSONValue.toJSONString(o);
    }

    /**
     * Compares a host value (as returned by {@link Realm#toHost(Object)})
     * against a JSON literal, numbers compare by value.
     */
    public static void match(Object actual, String json) {
        Object expected = fromJson(json);
        isEqualTo(actual, expected, "$");
    }

    private static void isEqualTo(Object actual, Object expected, String path) {
        if (expected instanceof List) {
            if (!(actual instanceof List)) {
                Assertions.fail(path + ": list expected, actual is: " + actual);
            }
            List<Object> actList = (List<Object>) actual;
            List<Object> expList = (List<Object>) expected;
            Assertions.assertEquals(expList.size(), actList.size(), path + ": list size mismatch");
            for (int i = 0; i < expList.size(); i++) {
                isEqualTo(actList.get(i), expList.get(i), path + "[" + i + "]");
            }
        } else if (expected instanceof Map) {
            if (!(actual instanceof Map)) {
                Assertions.fail(path + ": map expected, actual is: " + actual);
            }
            Map<String, Object> actMap = (Map<String, Object>) actual;
            Map<String, Object> expMap = (Map<String, Object>) expected;
            Assertions.assertEquals(expMap.keySet(), actMap.keySet(), path + ": keys mismatch");
            for (String key : expMap.keySet()) {
                isEqualTo(actMap.get(key), expMap.get(key), path + "." + key);
            }
        } else if (expected instanceof Number && actual instanceof Number) {
            Assertions.assertEquals(((Number) expected).doubleValue(), ((Number) actual).doubleValue(), path);
        } else {
            Assertions.assertEquals(expected, actual, path);
        }
    }

    /**
     * Compact form of a syntax tree for assertions: single-child nodes
     * collapse, identifiers get a {@code $} prefix, literals become values.
     */
    public static Object ser(Node node) {
        switch (node.type) {
            case PAREN_EXPR:
                return ser(node.get(1));
            case OBJECT_ELEM:
                if (node.size() < 3) { // shorthand
                    return ser(node.getFirst());
                } else {
                    return List.of(ser(node.get(0)) + ":", ser(node.get(2)));
                }
            case ARRAY_ELEM:
                return ser(node.get(0));
            case PROGRAM:
            case ROOT:
                String key = node.type.name();
                if (node.size() == 1) {
                    return Collections.singletonMap(key, ser(node.get(0)));
                } else {
                    List<Object> list = new ArrayList<>(node.size());
                    for (Node child : node) {
                        list.add(ser(child));
                    }
                    return Collections.singletonMap(key, list);
                }
            case TOKEN:
                switch (node.token.type) {
                    case EOF:
                        return "EOF";
                    case IDENT:
                        return "$" + node.token.getText();
                    case S_STRING:
                    case D_STRING:
                    case NUMBER:
                    case NULL:
                    case TRUE:
                    case FALSE:
                        return Terms.literalValue(node.token);
                    default:
                        return node.token.getText();
                }
            default:
                if (node.size() == 1) {
                    return ser(node.get(0));
                } else {
                    List<Object> list = new ArrayList<>();
                    for (Node child : node) {
                        list.add(ser(child));
                    }
                    return list;
                }
        }
    }

    public static void assertEquals(String text, Node node, String json) {
        Object expected = fromJson(json);
        String expectedJson = toJson(expected);
        String actualJson = toJson(ser(node));
        try {
            Assertions.assertEquals(expectedJson, actualJson);
        } catch (Throwable t) {
            logger.debug("text:\n{}", text);
            throw t;
        }
    }

}
