package github.sarthakdev143.production_planner.model.manifest;

import java.util.Map;

public record AudioPlan(
        TtsDefaults ttsDefaults,
        Map<String, String> narration,
        Map<String, MusicCue> cueMap) {

    public AudioPlan {
        narration = narration == null ? Map.of() : Map.copyOf(narration);
        cueMap = cueMap == null ? Map.of() : Map.copyOf(cueMap);
    }
}
