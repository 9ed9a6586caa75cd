package com.github.raff.webhook.attribution;

import com.github.raff.webhook.config.WebhookProperties;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Format gate for referrer codes, applied before any lookup. */
@Component
public class ReferrerCodePolicy {

    private final Pattern pattern;

    public ReferrerCodePolicy(WebhookProperties props) {
        this.pattern = Pattern.compile(props.getAttribution().getReferrerPattern());
    }

    public boolean isValid(String referrerCode) {
        return referrerCode != null && pattern.matcher(referrerCode.trim()).matches();
    }
}
