package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.func.FactoryMap;

import java.util.List;
import java.util.Map;

/**
 * The built-in function catalog, usable with every transform context.
 *
 * <pre>{@code
 * Parser<SpanContext> parser = SpanContext.newParser(StandardFunctions.all());
 * }</pre>
 */
public final class StandardFunctions {
    private StandardFunctions() {
    }

    public static <K> Map<String, Factory<K>> converters() {
        return build(List.of(
            TypeCheckConverters.<K>isString(),
            TypeCheckConverters.<K>isInt(),
            TypeCheckConverters.<K>isDouble(),
            TypeCheckConverters.<K>isBool(),
            TypeCheckConverters.<K>isMap(),
            TypeCheckConverters.<K>isList(),
            TypeCheckConverters.<K>isMatch(),
            ConversionConverters.<K>toInt(),
            ConversionConverters.<K>toDouble(),
            ConversionConverters.<K>toStringValue(),
            ConversionConverters.<K>hex(),
            ConversionConverters.<K>sha256(),
            ConversionConverters.<K>base64Decode(),
            ConversionConverters.<K>parseJson(),
            StringConverters.<K>concat(),
            StringConverters.<K>split(),
            StringConverters.<K>len(),
            StringConverters.<K>toLowerCase(),
            StringConverters.<K>toUpperCase(),
            StringConverters.<K>substring(),
            TimeConverters.<K>now(),
            TimeConverters.<K>duration(),
            TimeConverters.<K>time(),
            TimeConverters.<K>unixNano(),
            CollectionConverters.<K>sort(),
            CollectionConverters.<K>keys()));
    }

    public static <K> Map<String, Factory<K>> editors() {
        return build(List.of(
            MapEditors.<K>set(),
            MapEditors.<K>append(),
            MapEditors.<K>deleteKey(),
            MapEditors.<K>deleteMatchingKeys(),
            MapEditors.<K>keepKeys(),
            MapEditors.<K>keepMatchingKeys(),
            MapEditors.<K>limit(),
            MapEditors.<K>truncateAll(),
            MapEditors.<K>flatten(),
            MapEditors.<K>mergeMaps(),
            ReplaceEditors.<K>replacePattern(),
            ReplaceEditors.<K>replaceAllPatterns(),
            ReplaceEditors.<K>replaceMatch(),
            ReplaceEditors.<K>replaceAllMatches()));
    }

    /**
     * Editors and converters together.
     */
    public static <K> Map<String, Factory<K>> all() {
        try {
            return FactoryMap.merge(StandardFunctions.<K>editors(), StandardFunctions.<K>converters());
        } catch (ConfigException e) {
            throw new IllegalStateException("built-in function catalog is inconsistent", e);
        }
    }

    private static <K> Map<String, Factory<K>> build(List<Factory<K>> factories) {
        try {
            return FactoryMap.of(factories);
        } catch (ConfigException e) {
            throw new IllegalStateException("built-in function catalog is inconsistent", e);
        }
    }
}
