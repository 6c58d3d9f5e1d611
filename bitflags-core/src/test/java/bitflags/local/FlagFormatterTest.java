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

package bitflags.local;

import org.junit.jupiter.api.Test;

import bitflags.api.FlagEnumDescriptor;
import bitflags.api.ResolvedVariantTable.Variant;
import bitflags.api.Width;

import static org.assertj.core.api.Assertions.assertThat;

public class FlagFormatterTest
{
    private static final FlagFormatter TYPE = new FlagFormatter(BitAllocator.allocate(FlagEnumDescriptor.builder("Type")
                                                                                                         .width(Width.U8)
                                                                                                         .variant("None", 0)
                                                                                                         .variant("A", 1)
                                                                                                         .variant("B", 2)
                                                                                                         .variant("C", 4)
                                                                                                         .build()));

    @Test
    public void formatsEmptyAsEmptyVariant()
    {
        assertThat(TYPE.format(0)).isEqualTo("Type::None");
    }

    @Test
    public void formatsSingleVariantBare()
    {
        assertThat(TYPE.format(1)).isEqualTo("Type::A");
        assertThat(TYPE.format(4)).isEqualTo("Type::C");
    }

    @Test
    public void formatsCombinationsInDeclarationOrder()
    {
        assertThat(TYPE.format(0b101)).isEqualTo("(Type::A | Type::C)");
        assertThat(TYPE.format(0b111)).isEqualTo("(Type::A | Type::B | Type::C)");
    }

    @Test
    public void formatsResidualBitsAsHex()
    {
        assertThat(TYPE.format(0b1001)).isEqualTo("(Type::A | 0x8)");
        assertThat(TYPE.format(0xF0)).isEqualTo("(0xf0)");
        assertThat(TYPE.format(0xFF)).isEqualTo("(Type::A | Type::B | Type::C | 0xf8)");
        assertThat(TYPE.residual(0xFF)).isEqualTo(0xF8L);
        assertThat(TYPE.residual(0b11)).isZero();
    }

    @Test
    public void decomposeSkipsEmptyVariant()
    {
        assertThat(TYPE.decompose(0)).isEmpty();
        assertThat(TYPE.decompose(0b110)).extracting(Variant::name).containsExactly("B", "C");
    }

    @Test
    public void multiBitVariants()
    {
        FlagFormatter access = new FlagFormatter(BitAllocator.allocate(FlagEnumDescriptor.builder("Access")
                                                                                         .variants("None", "Read", "Write")
                                                                                         .variant("ReadWrite", 3)
                                                                                         .variant("Exec")
                                                                                         .build()));
        assertThat(access.format(3)).isEqualTo("(Access::Read | Access::Write | Access::ReadWrite)");
        assertThat(access.format(7)).isEqualTo("(Access::Read | Access::Write | Access::ReadWrite | Access::Exec)");

        // a multi-bit variant only partially present accounts for none of its bits
        FlagFormatter wide = new FlagFormatter(BitAllocator.allocate(FlagEnumDescriptor.builder("Wide")
                                                                                       .variant("None")
                                                                                       .variant("Pair", 0b11)
                                                                                       .build()));
        assertThat(wide.format(0b11)).isEqualTo("Wide::Pair");
        assertThat(wide.format(0b01)).isEqualTo("(0x1)");
        assertThat(wide.decompose(0b01)).isEmpty();
    }
}
