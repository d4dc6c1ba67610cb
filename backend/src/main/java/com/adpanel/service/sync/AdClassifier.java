package com.adpanel.service.sync;

import com.adpanel.entity.AdCategory;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Infers the managed category of an ad from the tokens its naming convention embeds. Names are
 * checked upper-cased; the rule table is ordered and the first rule that matches any name wins,
 * so ABX takes precedence over ACE. Ads named outside the convention are GENERAL.
 *
 * <p>This is substring matching: an unrelated name that happens to contain a token is
 * misclassified. Tokens keep their underscores so words such as "FACEBOOK" do not match ACE.
 */
@Component
public class AdClassifier {

    private static final List<ClassificationRule> RULES =
            List.of(
                    new ClassificationRule("_ABX_", AdCategory.ABX),
                    new ClassificationRule("_ACE_", AdCategory.ACE));

    public AdCategory classify(String... names) {
        for (ClassificationRule rule : RULES) {
            for (String name : names) {
                if (name != null && name.toUpperCase(Locale.ROOT).contains(rule.token())) {
                    return rule.category();
                }
            }
        }
        return AdCategory.GENERAL;
    }

    record ClassificationRule(String token, AdCategory category) {}
}
