package me.golemcore.router.routing;

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

import me.golemcore.router.domain.model.Decision;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises provider management commands typed verbatim, so they never reach
 * the oracle:
 *
 * <pre>
 * list servers | list providers
 * server status | provider status
 * activate|enable server|provider &lt;id&gt;
 * deactivate|disable server|provider &lt;id&gt;
 * remove server|provider &lt;id&gt; [and delete files]
 * install server|provider &lt;id&gt;
 * </pre>
 */
@Component
public class ManagementCommandMatcher {

    private static final String TARGET = "(?:server|provider)";
    private static final String ID = "([A-Za-z0-9_.-]+)";

    private static final Pattern LIST = command("^(?:list|show)(?: all)? (?:servers|providers)$");
    private static final Pattern STATUS = command("^" + TARGET + "s? status$");
    private static final Pattern ENABLE = command("^(?:activate|enable) " + TARGET + " " + ID + "$");
    private static final Pattern DISABLE = command("^(?:deactivate|disable) " + TARGET + " " + ID + "$");
    private static final Pattern REMOVE = command(
            "^remove " + TARGET + " " + ID + "( and delete (?:its |the )?files)?$");
    private static final Pattern INSTALL = command(
            "^install (?:dependencies for )?" + TARGET + " " + ID + "$");

    public Optional<Decision> match(String userText) {
        if (userText == null) {
            return Optional.empty();
        }
        String text = normalize(userText);
        if (text.isEmpty()) {
            return Optional.empty();
        }

        if (LIST.matcher(text).matches()) {
            return Optional.of(new Decision.ListProviders());
        }
        if (STATUS.matcher(text).matches()) {
            return Optional.of(new Decision.ProviderStatus());
        }
        Matcher m = ENABLE.matcher(text);
        if (m.matches()) {
            return Optional.of(new Decision.SetProviderEnabled(m.group(1), true));
        }
        m = DISABLE.matcher(text);
        if (m.matches()) {
            return Optional.of(new Decision.SetProviderEnabled(m.group(1), false));
        }
        m = REMOVE.matcher(text);
        if (m.matches()) {
            return Optional.of(new Decision.RemoveProvider(m.group(1), m.group(2) != null));
        }
        m = INSTALL.matcher(text);
        if (m.matches()) {
            return Optional.of(new Decision.InstallProviderDependencies(m.group(1)));
        }
        return Optional.empty();
    }

    private static Pattern command(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static String normalize(String userText) {
        String text = userText.trim().replaceAll("\\s+", " ");
        while (!text.isEmpty() && ".!?".indexOf(text.charAt(text.length() - 1)) >= 0) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }
}
