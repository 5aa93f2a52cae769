package com.example.sos.trigger;

import java.util.List;
import java.util.Locale;

final class VoicePhrases {

    private final List<String> trigger;
    private final List<String> cancel;
    private final List<String> confirm;

    VoicePhrases(List<String> trigger, List<String> cancel, List<String> confirm) {
        this.trigger = normalize(trigger);
        this.cancel = normalize(cancel);
        this.confirm = normalize(confirm);
    }

    VoiceCommand classify(String transcript, TriggerState state) {
        if (transcript == null || transcript.isBlank()) {
            return VoiceCommand.NONE;
        }
        String text = transcript.toLowerCase(Locale.ROOT);
        return switch (state) {
            case IDLE -> containsAny(text, trigger) && !containsAny(text, cancel)
                ? VoiceCommand.TRIGGER
                : VoiceCommand.NONE;
            case CONFIRMING -> {
                if (containsAny(text, cancel)) yield VoiceCommand.CANCEL;
                if (containsAny(text, confirm)) yield VoiceCommand.CONFIRM;
                yield VoiceCommand.NONE;
            }
            default -> VoiceCommand.NONE;
        };
    }

    private static boolean containsAny(String text, List<String> phrases) {
        for (String p : phrases) {
            if (text.contains(p)) return true;
        }
        return false;
    }

    private static List<String> normalize(List<String> phrases) {
        return phrases
            .stream()
            .map(p -> p.trim().toLowerCase(Locale.ROOT))
            .filter(p -> !p.isEmpty())
            .toList();
    }
}
