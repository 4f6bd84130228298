package me.relaybot.gateway.domain.service;

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

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Flattens answer text for speech output: drops bullet and numbered-list
 * markers at line starts and collapses blank lines.
 */
@Component
public class ResponseCleaner {

    private static final List<String> BULLETS = List.of("-", "*", "•", "·", "—");
    private static final Pattern NUMBERED_ITEM = Pattern.compile("\n\\d+[.)、]\\s*");
    private static final Pattern BLANK_LINES = Pattern.compile("\n{2,}");

    public String clean(String text) {
        if (text == null) {
            return "";
        }
        String clean = text.strip();
        for (String bullet : BULLETS) {
            clean = clean.replace("\n" + bullet + " ", "\n");
            clean = clean.replace("\n" + bullet, "\n");
        }
        clean = NUMBERED_ITEM.matcher(clean).replaceAll("\n");
        return BLANK_LINES.matcher(clean).replaceAll("\n").strip();
    }
}
