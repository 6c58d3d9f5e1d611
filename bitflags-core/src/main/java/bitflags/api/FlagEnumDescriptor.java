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

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import bitflags.utils.Invariants;

/**
 * The declaration of one flag enum: its name, backing width, the variants in declaration order
 * (each optionally with an explicit value) and the name of the variant that must resolve to zero.
 * Immutable; consumed once by the allocator.
 */
public class FlagEnumDescriptor
{
    public static final String DEFAULT_EMPTY_VARIANT = "None";

    public static class VariantDeclaration
    {
        final String name;
        @Nullable final Long explicitValue;

        public VariantDeclaration(String name, @Nullable Long explicitValue)
        {
            this.name = Invariants.nonNull(name, "variant name");
            this.explicitValue = explicitValue;
        }

        public String name()
        {
            return name;
        }

        public boolean hasExplicitValue()
        {
            return explicitValue != null;
        }

        @Nullable
        public Long explicitValue()
        {
            return explicitValue;
        }

        @Override
        public String toString()
        {
            return explicitValue == null ? name : name + " = " + Long.toUnsignedString(explicitValue);
        }
    }

    public static class Builder
    {
        private final String typeName;
        private Width width = Width.DEFAULT;
        private String emptyVariant = DEFAULT_EMPTY_VARIANT;
        private final List<VariantDeclaration> variants = new ArrayList<>();

        private Builder(String typeName)
        {
            this.typeName = typeName;
        }

        public Builder width(Width width)
        {
            this.width = Invariants.nonNull(width);
            return this;
        }

        public Builder emptyVariant(String name)
        {
            this.emptyVariant = Invariants.nonNull(name);
            return this;
        }

        /**
         * Declares a variant whose value is assigned by the allocator.
         */
        public Builder variant(String name)
        {
            variants.add(new VariantDeclaration(name, null));
            return this;
        }

        public Builder variant(String name, long explicitValue)
        {
            variants.add(new VariantDeclaration(name, explicitValue));
            return this;
        }

        public Builder variants(String ... names)
        {
            for (String name : names)
                variant(name);
            return this;
        }

        public FlagEnumDescriptor build()
        {
            return new FlagEnumDescriptor(typeName, width, ImmutableList.copyOf(variants), emptyVariant);
        }
    }

    final String typeName;
    final Width width;
    final ImmutableList<VariantDeclaration> variants;
    final String emptyVariant;

    public FlagEnumDescriptor(String typeName, Width width, List<VariantDeclaration> variants, String emptyVariant)
    {
        this.typeName = Invariants.nonNull(typeName, "typeName");
        this.width = Invariants.nonNull(width, "width");
        this.variants = ImmutableList.copyOf(variants);
        this.emptyVariant = Invariants.nonNull(emptyVariant, "emptyVariant");
    }

    public static Builder builder(String typeName)
    {
        return new Builder(Invariants.nonNull(typeName, "typeName"));
    }

    public String typeName()
    {
        return typeName;
    }

    public Width width()
    {
        return width;
    }

    public ImmutableList<VariantDeclaration> variants()
    {
        return variants;
    }

    public String emptyVariant()
    {
        return emptyVariant;
    }

    @Override
    public String toString()
    {
        return typeName + '(' + width + "){" + variants + '}';
    }
}
