package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.path.Path;
import com.acme.finops.ottl.path.Paths;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.Profile;
import com.acme.finops.ottl.pdata.Resource;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record ProfileContext(Profile profile, InstrumentationScope scope, Resource resource, PMap cache) {
    public static final String NAME = "profile";
    static final List<String> OWN_FIELDS = List.of(
        "profile_id", "time_unix_nano", "time", "duration_unix_nano", "duration", "original_payload_format",
        "attributes", "dropped_attributes_count");
    static final List<String> FIELDS = CommonPaths.known(OWN_FIELDS, "resource", "instrumentation_scope", "cache");

    public ProfileContext {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(cache, "cache");
    }

    public ProfileContext(Profile profile, InstrumentationScope scope, Resource resource) {
        this(profile, scope, resource, new PMap());
    }

    public static Parser<ProfileContext> newParser(Map<String, Factory<ProfileContext>> functions) {
        return Parser.<ProfileContext>builder(NAME, ProfileContext::resolve).functions(functions).build();
    }

    static GetSetter<ProfileContext> resolve(Path<ProfileContext> path) throws ConfigException {
        return switch (path.name()) {
            case "profile_id" -> CommonPaths.id(path,
                c -> c.profile().profileId(), (c, v) -> c.profile().setProfileId(v), Profile.PROFILE_ID_LENGTH);
            case "time_unix_nano" -> CommonPaths.int64(path,
                c -> c.profile().timeUnixNano(), (c, v) -> c.profile().setTimeUnixNano(v));
            case "time" -> CommonPaths.time(path,
                c -> c.profile().timeUnixNano(), (c, v) -> c.profile().setTimeUnixNano(v));
            case "duration_unix_nano" -> CommonPaths.int64(path,
                c -> c.profile().durationNano(), (c, v) -> c.profile().setDurationNano(v));
            case "duration" -> {
                Paths.requireTerminal(path);
                yield GetSetter.of(
                    (ctx, c) -> Duration.ofNanos(c.profile().durationNano()),
                    (ctx, c, value) -> {
                        if (value instanceof Duration d) {
                            c.profile().setDurationNano(d.toNanos());
                        }
                    });
            }
            case "original_payload_format" -> CommonPaths.string(path,
                c -> c.profile().originalPayloadFormat(), (c, v) -> c.profile().setOriginalPayloadFormat(v));
            case "attributes" -> CommonPaths.map(path, c -> c.profile().attributes());
            case "dropped_attributes_count" -> CommonPaths.int64(path,
                c -> c.profile().droppedAttributesCount(), (c, v) -> c.profile().setDroppedAttributesCount(v));
            case "resource" -> CommonPaths.resource(path, ProfileContext::resource);
            case "instrumentation_scope", "scope" -> CommonPaths.scope(path, ProfileContext::scope);
            case "cache" -> CommonPaths.map(path, ProfileContext::cache);
            default -> throw Paths.unknownField(path, NAME, FIELDS);
        };
    }
}
