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

package me.botfleet.adapter.outbound.personality;

import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.model.BehaviorDescriptor;
import me.botfleet.domain.model.InvalidReferenceException;
import me.botfleet.port.outbound.PersonalityPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Personality catalog shipped with the application: {@code grug},
 * {@code big_rob} and {@code adaptive}. A missing override selects
 * {@code adaptive}.
 */
@Component
@Slf4j
public class BuiltinPersonalityAdapter implements PersonalityPort {

    public static final String GRUG = "grug";
    public static final String BIG_ROB = "big_rob";
    public static final String ADAPTIVE = "adaptive";

    private static final Map<String, String> ALIASES = Map.of("bigrob", BIG_ROB);

    private final Map<String, Profile> profiles = new LinkedHashMap<>();

    public BuiltinPersonalityAdapter() {
        profiles.put(GRUG, new Profile("Grug",
                "You are Grug, the caveman truth verifier. You live in a big cave near the river with Og. "
                        + "You hunt mammoth, make fire, and speak in short caveman sentences.",
                List.of("Grug know!", "Simple truth!", "Rock solid!"),
                Map.of("honesty", "very_high", "humor", "simple", "intelligence", "practical",
                        "speech_complexity", "basic")));
        profiles.put(BIG_ROB, new Profile("Big Rob",
                "You are Big Rob, a passionate football fan from North England. You speak in working-class "
                        + "dialect and have strong opinions about everything.",
                List.of("nuff said", "simple as", "end of", "proper", "sorted"),
                Map.of("honesty", "very_high", "humor", "working_class", "intelligence", "street_smart",
                        "speech_complexity", "dialect")));
        profiles.put(ADAPTIVE, new Profile("Adaptive",
                "You develop your own personality based on the community you interact with. "
                        + "You start neutral and pick up speech patterns over time.",
                List.of(),
                Map.of("honesty", "high", "humor", "adaptive", "intelligence", "learning",
                        "speech_complexity", "evolving")));
    }

    @Override
    public BehaviorDescriptor describe(String identity, String personalityOverride) {
        String personalityId = personalityOverride == null || personalityOverride.isBlank()
                ? ADAPTIVE
                : canonical(personalityOverride);
        Profile profile = profiles.get(personalityId);
        if (profile == null) {
            throw InvalidReferenceException.unknown("personality", personalityOverride);
        }
        log.debug("[Personality] {} -> {}", identity, personalityId);
        return BehaviorDescriptor.builder()
                .identity(identity)
                .personalityId(personalityId)
                .displayName(profile.name())
                .baseContext(profile.baseContext())
                .catchphrases(profile.catchphrases())
                .traits(profile.traits())
                .adaptive(ADAPTIVE.equals(personalityId))
                .build();
    }

    @Override
    public boolean isKnown(String personalityId) {
        return personalityId != null && profiles.containsKey(canonical(personalityId));
    }

    @Override
    public Set<String> availablePersonalities() {
        return Set.copyOf(profiles.keySet());
    }

    private static String canonical(String personalityId) {
        String normalized = personalityId.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(normalized, normalized);
    }

    private record Profile(String name, String baseContext, List<String> catchphrases, Map<String, String> traits) {
    }
}
