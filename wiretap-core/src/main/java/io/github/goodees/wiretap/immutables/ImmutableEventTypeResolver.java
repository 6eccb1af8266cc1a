package io.github.goodees.wiretap.immutables;

/*-
 * #%L
 * wiretap
 * %%
 * Copyright (C) 2026 The Wiretap Authors
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import com.fasterxml.jackson.databind.type.TypeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves type ids of {@link ImmutableEvent}s. Type {@code RequestReceived} maps to class
 * {@code ImmutableRequestReceivedEvent} in the package of the base type the resolver was initialized with.
 * Ids without a matching class resolve to nothing, so that Jackson reports an invalid type id.
 */
public class ImmutableEventTypeResolver extends TypeIdResolverBase {
    private static final Logger logger = LoggerFactory.getLogger(ImmutableEventTypeResolver.class);
    private final static String PREFIX = "Immutable";
    private final static String SUFFIX = "Event";

    private String basePackage;

    @Override
    public void init(JavaType bt) {
        String className = bt.getRawClass().getName();
        this.basePackage = className.substring(0, className.lastIndexOf("."));
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) {
        return typeFromId(id, context.getTypeFactory());
    }

    JavaType typeFromId(String id, TypeFactory typeFactory) {
        String className = basePackage + "." + generateClassName(id);
        try {
            return typeFactory.constructType(typeFactory.findClass(className));
        } catch (ClassNotFoundException ex) {
            logger.debug("No event class {} for type {}", className, id);
            return null;
        }
    }

    @Override
    public String idFromValue(Object value) {
        if (value instanceof ImmutableEvent) {
            return ((ImmutableEvent) value).getType();
        } else {
            throw new IllegalArgumentException(
                "This type resolver is only for non-null descendants of ImmutableEvent, was given " + value);
        }
    }

    @Override
    public String idFromValueAndType(Object value, Class<?> suggestedType) {
        if (value instanceof ImmutableEvent && ImmutableEvent.class.isAssignableFrom(suggestedType)) {
            return ((ImmutableEvent) value).getType();
        } else {
            throw new IllegalArgumentException(
                "This type resolver is only for non-null descendants of ImmutableEvent, " + "was given "
                        + suggestedType.getName() + " " + value);
        }
    }

    @Override
    public JsonTypeInfo.Id getMechanism() {
        return JsonTypeInfo.Id.CUSTOM;
    }

    private String generateClassName(String id) {
        return PREFIX + id + SUFFIX;
    }

}
