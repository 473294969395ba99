package me.toolpilot.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Capability flags a tool declares: {@code r} (read), {@code w} (write),
 * {@code x} (execute) and {@code n} (network).
 *
 * <p>
 * Flags are descriptive metadata on the registry. Enforcement happens in
 * {@link me.toolpilot.domain.service.ToolPermissionPolicy}.
 */
public enum ToolPermission {

    READ('r'),
    WRITE('w'),
    EXECUTE('x'),
    NETWORK('n');

    private final char flag;

    ToolPermission(char flag) {
        this.flag = flag;
    }

    public char getFlag() {
        return flag;
    }

    /**
     * Parses a flag string such as {@code "rw"}. Whitespace is ignored, unknown
     * characters are rejected.
     */
    public static Set<ToolPermission> parse(String flags) {
        Set<ToolPermission> result = EnumSet.noneOf(ToolPermission.class);
        if (flags == null) {
            return result;
        }
        for (char c : flags.toLowerCase(Locale.ROOT).toCharArray()) {
            if (Character.isWhitespace(c) || c == ',') {
                continue;
            }
            result.add(fromFlag(c));
        }
        return result;
    }

    public static ToolPermission fromFlag(char flag) {
        for (ToolPermission permission : values()) {
            if (permission.flag == flag) {
                return permission;
            }
        }
        throw new IllegalArgumentException("Unknown permission flag: '" + flag + "'");
    }

    /**
     * Renders permissions in canonical {@code rwxn} order.
     */
    public static String format(Set<ToolPermission> permissions) {
        StringBuilder sb = new StringBuilder();
        for (ToolPermission permission : values()) {
            if (permissions != null && permissions.contains(permission)) {
                sb.append(permission.flag);
            }
        }
        return sb.toString();
    }
}
