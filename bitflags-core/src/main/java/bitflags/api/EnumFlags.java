/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package bitflags.api;

import java.util.EnumMap;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import bitflags.api.ResolvedVariantTable.Variant;

/**
 * Declares a {@link FlagEnum} from an ordinary Java enum, one variant per constant in declaration
 * order. Explicit values come from {@link Flag}, the width and empty constant from {@link FlagEnumType}:
 * <pre>
 * &#64;FlagEnumType(width = Width.U8)
 * enum Access { None, Read, Write, &#64;Flag(0x80) Admin }
 * EnumFlags&lt;Access&gt; access = EnumFlags.declare(Access.class);
 * FlagValue rw = access.of(Read, Write);
 * </pre>
 */
public class EnumFlags<E extends Enum<E>>
{
    private static final Logger logger = LoggerFactory.getLogger(EnumFlags.class);

    private final Class<E> enumClass;
    private final FlagEnum flags;
    private final E[] constants;
    private final EnumMap<E, FlagValue> values;

    private EnumFlags(Class<E> enumClass, FlagEnum flags)
    {
        this.enumClass = enumClass;
        this.flags = flags;
        this.constants = enumClass.getEnumConstants();
        this.values = new EnumMap<>(enumClass);
        for (E constant : constants)
            values.put(constant, flags.of(constant.name()));
    }

    public static <E extends Enum<E>> EnumFlags<E> declare(Class<E> enumClass)
    {
        FlagEnum flags = FlagEnum.declare(describe(enumClass));
        logger.debug("Declared {} from {}", flags.name(), enumClass.getName());
        return new EnumFlags<>(enumClass, flags);
    }

    public static <E extends Enum<E>> FlagEnumDescriptor describe(Class<E> enumClass)
    {
        FlagEnumType type = enumClass.getAnnotation(FlagEnumType.class);
        String name = type == null || type.name().isEmpty() ? enumClass.getSimpleName() : type.name();
        FlagEnumDescriptor.Builder builder = FlagEnumDescriptor.builder(name);
        if (type != null)
            builder.width(type.width()).emptyVariant(type.empty());

        for (E constant : enumClass.getEnumConstants())
        {
            Flag flag = explicit(enumClass, constant);
            if (flag == null) builder.variant(constant.name());
            else builder.variant(constant.name(), flag.value());
        }
        return builder.build();
    }

    @Nullable
    private static <E extends Enum<E>> Flag explicit(Class<E> enumClass, E constant)
    {
        try
        {
            return enumClass.getField(constant.name()).getAnnotation(Flag.class);
        }
        catch (NoSuchFieldException e)
        {
            throw new IllegalStateException("Enum constant " + constant.name() + " has no field in " + enumClass.getName(), e);
        }
    }

    public Class<E> enumClass()
    {
        return enumClass;
    }

    public FlagEnum flags()
    {
        return flags;
    }

    public FlagValue of(E constant)
    {
        return values.get(constant);
    }

    @SafeVarargs
    public final FlagValue of(E first, E ... rest)
    {
        FlagValue value = of(first);
        for (E constant : rest)
            value = value.or(of(constant));
        return value;
    }

    public FlagValue none()
    {
        return flags.none();
    }

    public boolean has(FlagValue value, E constant)
    {
        return value.contains(of(constant));
    }

    /**
     * @return the constant whose value equals {@code value} exactly, or null for composed values
     */
    @Nullable
    public E constantOf(FlagValue value)
    {
        Variant variant = flags.dispatch(value).variant();
        return variant == null ? null : constants[variant.ordinal()];
    }
}
