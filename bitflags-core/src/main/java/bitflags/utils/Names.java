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

package bitflags.utils;

public class Names
{
    private Names() {}

    /**
     * Lower-cases ASCII upper-case letters, inserting an underscore before each one that is not
     * the first character: {@code ReadWrite -> read_write}, {@code A -> a}, {@code HTTP -> h_t_t_p}.
     * Everything else is copied unchanged.
     */
    public static String toSnakeCase(String name)
    {
        StringBuilder builder = new StringBuilder(name.length() + 4);
        for (int i = 0 ; i < name.length() ; ++i)
        {
            char c = name.charAt(i);
            if (c >= 'A' && c <= 'Z')
            {
                if (i > 0)
                    builder.append('_');
                builder.append((char) (c + ('a' - 'A')));
            }
            else
            {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    public static String accessorName(String variantName)
    {
        return "has_" + toSnakeCase(variantName);
    }

    public static boolean isIdentifier(String name)
    {
        if (name.isEmpty() || !Character.isJavaIdentifierStart(name.charAt(0)))
            return false;
        for (int i = 1 ; i < name.length() ; ++i)
        {
            if (!Character.isJavaIdentifierPart(name.charAt(i)))
                return false;
        }
        return true;
    }
}
