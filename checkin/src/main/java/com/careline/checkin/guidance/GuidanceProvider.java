package com.careline.checkin.guidance;

import com.careline.checkin.model.GuidanceTip;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fixed tip library keyed by the categorizer's symptom and concern tags.
 * Tips come back in library order, each at most once.
 */
@Component
public class GuidanceProvider {

    private static final List<GuidanceTip> LIBRARY = List.of(
        new GuidanceTip("cramps_hydration", "Muscle cramps",
            "Gently stretch the cramped muscle and massage the area. Sip cool water if your care team allows fluids.",
            List.of("cramps")),
        new GuidanceTip("nausea_small_meals", "Nausea",
            "Try small, bland snacks and slow, deep breaths. If vomiting, contact your care team.",
            List.of("nausea")),
        new GuidanceTip("dizziness_sit", "Dizziness",
            "Sit or lie down until it passes. Stand up slowly and avoid sudden head movements.",
            List.of("dizziness")),
        new GuidanceTip("sob_escalate", "Shortness of breath",
            "If you can't catch your breath or it worsens, seek urgent help. If mild, sit upright, loosen clothing, and focus on slow exhales.",
            List.of("shortness_of_breath")),
        new GuidanceTip("swelling_track", "Swelling",
            "Elevate your legs if able. Watch for rapid changes or pain and notify your care team.",
            List.of("swelling")),
        new GuidanceTip("headache_rest", "Headache",
            "Rest in a dim room and hydrate if allowed. If sudden/severe or with vision changes, contact your care team.",
            List.of("headache")),
        new GuidanceTip("access_redness", "Access site issues",
            "Check for redness, warmth, or drainage. Keep the site clean and dry; report any changes to your care team.",
            List.of("access_site", "access_care")),
        new GuidanceTip("fatigue_pace", "Fatigue",
            "Pace activities, take short rests, and choose light meals. If rapidly worsening, notify your care team.",
            List.of("fatigue")),
        new GuidanceTip("fever_chills", "Fever or chills",
            "Monitor temperature and watch for shaking chills or confusion. Contact your care team promptly.",
            List.of("fever_chills")),
        new GuidanceTip("diet_fluids", "Diet and fluids",
            "Follow your renal diet and fluid limits. Spread fluid sips through the day and avoid high-salt foods.",
            List.of("diet_fluids")),
        new GuidanceTip("medications", "Medications",
            "Take meds as prescribed and don't double doses. If you missed a dose, ask your care team before adjusting.",
            List.of("medications")),
        new GuidanceTip("emotional_support", "Emotional support",
            "It's normal to feel stressed. Try slow breathing, brief walks if safe, and talk with someone you trust. "
                + "Reach out to your care team if mood is worsening.",
            List.of("emotional_support"))
    );

    public List<GuidanceTip> tips(Collection<String> symptomCategories, Collection<String> concernCategories) {
        Set<String> categories = new HashSet<>();
        if (symptomCategories != null) {
            categories.addAll(symptomCategories);
        }
        if (concernCategories != null) {
            categories.addAll(concernCategories);
        }
        if (categories.isEmpty()) {
            return List.of();
        }
        return LIBRARY.stream()
            .filter(tip -> !Collections.disjoint(tip.getCategories(), categories))
            .collect(Collectors.toList());
    }
}
