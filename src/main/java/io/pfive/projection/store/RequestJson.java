// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.pfive.projection.engine.AggregationMode;
import io.pfive.projection.engine.MapResult;
import io.pfive.projection.engine.MapWarning;
import io.pfive.projection.engine.PixelMap;
import io.pfive.projection.engine.ProjectionRequest;
import io.pfive.projection.engine.ResolutionSpec;
import io.pfive.projection.engine.Weighting;
import io.pfive.projection.exception.BadParameterException;
import io.pfive.projection.exception.InvalidRequestException;
import io.pfive.projection.geometry.Axis;
import io.pfive.projection.geometry.CenterCoordinate;
import io.pfive.projection.geometry.Direction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Reads projection requests from JSON documents and writes summaries of results back out. A request
/// document looks like this, with every key optional except variables and maxConcurrency:
///
/// ```
/// {
///   "variables": ["rho", "sd"],
///   "units": ["standard"],
///   "direction": "z",
///   "resolution": {"depth": 8},
///   "range": {"x": [-10, 10], "y": [-10, null]},
///   "rangeUnit": "kpc",
///   "center": ["boxcenter", "boxcenter", 12.5],
///   "dataCenter": "boxcenter",
///   "dataCenterUnit": "kpc",
///   "weighting": "mass",
///   "mode": "mean",
///   "maxConcurrency": 4
/// }
/// ```
///
/// The resolution object holds exactly one of `depth`, `pixels` or `pixelSize` (with an optional
/// `unit`). Centers are either one value applied to all axes or an array of three, where each entry
/// is a number or `"boxcenter"` (`"bc"`). The weighting names any per-record variable, or `"none"`.
/// Unknown keys are rejected so that misspellings do not
/// silently fall back to defaults.
public abstract class RequestJson {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final ObjectMapper objectMapper = new ObjectMapper().registerModule(new GuavaModule());

    private static final Set<String> KNOWN_KEYS = ImmutableSet.of("variables", "units", "direction", "resolution",
          "range", "rangeUnit", "center", "dataCenter", "dataCenterUnit", "weighting", "mode", "maxConcurrency");

    private static final Set<String> BOX_CENTER_NAMES = ImmutableSet.of("boxcenter", "bc");

    public static ProjectionRequest.Builder readBuilder (String json) {
        try {
            return builderFromTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("Request is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static ProjectionRequest.Builder readBuilder (InputStream inputStream) {
        try {
            return builderFromTree(objectMapper.readTree(inputStream));
        } catch (IOException e) {
            throw new InvalidRequestException("Could not read request document: " + e.getMessage(), e);
        }
    }

    public static ProjectionRequest.Builder builderFromTree (JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidRequestException("Request document must be a JSON object.");
        }
        for (Iterator<String> it = root.fieldNames(); it.hasNext(); ) {
            String key = it.next();
            if (!KNOWN_KEYS.contains(key)) throw new BadParameterException(key, root.get(key));
        }
        var builder = ProjectionRequest.builder();
        builder.variables(stringList(root, "variables"));
        builder.units(stringList(root, "units"));
        if (root.has("direction")) {
            String direction = root.get("direction").asText();
            try {
                builder.direction(Direction.parse(direction));
            } catch (IllegalArgumentException e) {
                throw new BadParameterException("direction", direction);
            }
        }
        if (root.has("resolution")) builder.resolution(resolution(root.get("resolution")));
        if (root.has("range")) {
            JsonNode range = root.get("range");
            for (Axis axis : Axis.values()) {
                JsonNode pair = range.get(axis.name().toLowerCase());
                if (pair == null) continue;
                if (!pair.isArray() || pair.size() != 2) throw new BadParameterException("range." + axis, pair);
                builder.range(axis, nullableDouble(pair.get(0)), nullableDouble(pair.get(1)));
            }
        }
        if (root.has("rangeUnit")) builder.rangeUnit(root.get("rangeUnit").asText());
        if (root.has("center")) {
            CenterCoordinate[] c = center(root.get("center"), "center");
            builder.center(c[0], c[1], c[2]);
        }
        if (root.has("dataCenter")) {
            CenterCoordinate[] c = center(root.get("dataCenter"), "dataCenter");
            builder.dataCenter(c[0], c[1], c[2]);
        }
        if (root.has("dataCenterUnit")) builder.dataCenterUnit(root.get("dataCenterUnit").asText());
        if (root.has("weighting")) builder.weighting(weighting(root.get("weighting")));
        if (root.has("mode")) builder.mode(enumValue(AggregationMode.class, root.get("mode"), "mode"));
        JsonNode concurrency = root.get("maxConcurrency");
        if (concurrency == null || !concurrency.canConvertToInt()) {
            throw new BadParameterException("maxConcurrency", concurrency);
        }
        builder.maxConcurrency(concurrency.intValue());
        return builder;
    }

    private static List<String> stringList (JsonNode root, String key) {
        JsonNode node = root.get(key);
        List<String> strings = new ArrayList<>();
        if (node == null) return strings;
        if (node.isTextual()) {
            strings.add(node.asText());
            return strings;
        }
        if (!node.isArray()) throw new BadParameterException(key, node);
        for (JsonNode element : node) {
            if (!element.isTextual()) throw new BadParameterException(key, node);
            strings.add(element.asText());
        }
        return strings;
    }

    private static ResolutionSpec resolution (JsonNode node) {
        if (!node.isObject() || node.size() == 0) throw new BadParameterException("resolution", node);
        if (node.has("depth") && node.size() == 1) return ResolutionSpec.depth(intValue(node.get("depth"), "depth"));
        if (node.has("pixels") && node.size() == 1) return ResolutionSpec.pixels(intValue(node.get("pixels"), "pixels"));
        if (node.has("pixelSize") && (node.size() == 1 || (node.size() == 2 && node.has("unit")))) {
            JsonNode size = node.get("pixelSize");
            if (!size.isNumber()) throw new BadParameterException("pixelSize", size);
            String unit = node.has("unit") ? node.get("unit").asText() : "standard";
            return ResolutionSpec.pixelSize(size.doubleValue(), unit);
        }
        throw new BadParameterException("resolution", node);
    }

    private static int intValue (JsonNode node, String name) {
        if (!node.canConvertToInt() || !node.isIntegralNumber()) throw new BadParameterException(name, node);
        return node.intValue();
    }

    private static Double nullableDouble (JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (!node.isNumber()) throw new BadParameterException("range", node);
        return node.doubleValue();
    }

    private static CenterCoordinate[] center (JsonNode node, String name) {
        if (!node.isArray()) {
            CenterCoordinate c = centerCoordinate(node, name);
            return new CenterCoordinate[] {c, c, c};
        }
        if (node.size() != 3) throw new BadParameterException(name, node);
        return new CenterCoordinate[] {
              centerCoordinate(node.get(0), name),
              centerCoordinate(node.get(1), name),
              centerCoordinate(node.get(2), name)
        };
    }

    private static CenterCoordinate centerCoordinate (JsonNode node, String name) {
        if (node.isNumber()) return CenterCoordinate.of(node.doubleValue());
        if (node.isTextual() && BOX_CENTER_NAMES.contains(node.asText().toLowerCase())) {
            return CenterCoordinate.boxCenter();
        }
        throw new BadParameterException(name, node);
    }

    /// A variable name, `"none"`, or an array of the name and an optional unit. The unit scales every
    /// weight alike and so does not change a weighted mean; it is only checked to be a string.
    private static Weighting weighting (JsonNode node) {
        if (node.isTextual() && !node.asText().isBlank()) return Weighting.parse(node.asText());
        if (node.isArray() && (node.size() == 1 || node.size() == 2)
              && node.get(0).isTextual() && !node.get(0).asText().isBlank()
              && (node.size() == 1 || node.get(1).isTextual())) {
            return Weighting.parse(node.get(0).asText());
        }
        throw new BadParameterException("weighting", node);
    }

    private static <E extends Enum<E>> E enumValue (Class<E> type, JsonNode node, String name) {
        try {
            return Enum.valueOf(type, node.asText().trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new BadParameterException(name, node.asText());
        }
    }

    /// A JSON description of a result without its pixel values: geometry, units, per-variable
    /// errors and warnings, and the depths of any coarse maps.
    public static String summary (MapResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("direction", result.direction.name().toLowerCase());
        summary.put("resolution", result.resolution());
        summary.put("nx", result.grid.nx());
        summary.put("ny", result.grid.ny());
        summary.put("rangeUnit", result.rangeUnit);
        summary.put("extent", result.extentInRangeUnit().toArray());
        summary.put("extentCenter", result.extentCenterInRangeUnit().toArray());
        summary.put("ratio", result.ratio());
        summary.put("pixelSize", result.pixelSizeInRangeUnit());
        Map<String, Object> maps = new LinkedHashMap<>();
        for (PixelMap map : result.maps().values()) {
            maps.put(map.variable, ImmutableMap.of("unit", map.unit, "mode", map.mode, "records", map.recordCount));
        }
        summary.put("maps", maps);
        summary.put("errors", result.errors());
        List<String> warnings = new ArrayList<>();
        for (MapWarning warning : result.warnings()) warnings.add(warning.message());
        summary.put("warnings", warnings);
        summary.put("coarseDepths", result.coarseMaps().keySet());
        try {
            return objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            LOG.error("Could not serialize result summary.", e);
            throw new RuntimeException(e);
        }
    }

}
