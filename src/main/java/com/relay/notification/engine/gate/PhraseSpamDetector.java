package com.relay.notification.engine.gate;

import com.relay.notification.config.FilterPipelineProperties;
import com.relay.notification.model.Notification;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Flags a notification as spam when enough configured phrases appear in its title or message.
 */
@Component
public class PhraseSpamDetector implements SpamDetector {

    private final List<String> phrases;
    private final int minMatches;

    @Autowired
    public PhraseSpamDetector(FilterPipelineProperties properties) {
        this(properties.getThresholds().getSpamPhrases(), properties.getThresholds().getSpamMinMatches());
    }

    public PhraseSpamDetector(List<String> phrases, int minMatches) {
        this.phrases = phrases.stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        this.minMatches = minMatches;
    }

    @Override
    public boolean isSpam(Notification notification) {
        String text = notification.searchableText();
        long matches = phrases.stream().filter(text::contains).count();
        return matches >= minMatches;
    }
}
