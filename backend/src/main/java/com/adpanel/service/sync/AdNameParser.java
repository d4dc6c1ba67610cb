package com.adpanel.service.sync;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Reads the product code and content style out of convention names such as {@code
 * [J3]_ABX_VV_(F_RETAIL_18_54)_SALE#01}.
 */
@Component
public class AdNameParser {

    private static final Pattern PRODUCT_CODE = Pattern.compile("^\\s*\\[([A-Za-z0-9]+)]");
    private static final Pattern GROUP_STYLE = Pattern.compile("_([A-Za-z]+)#\\d+\\s*$");

    /** First bracketed product code, upper-cased, or null when the name has none. */
    public String productGroup(String name) {
        if (name == null) {
            return null;
        }
        Matcher matcher = PRODUCT_CODE.matcher(name);
        return matcher.find() ? matcher.group(1).toUpperCase(Locale.ROOT) : null;
    }

    /** First product code found across the given names. */
    public String firstProductGroup(String... names) {
        for (String name : names) {
            String code = productGroup(name);
            if (code != null) {
                return code;
            }
        }
        return null;
    }

    /** Style suffix of an ABX ad-group name ("SALE" in "..._SALE#01"), or null. */
    public String groupStyle(String adGroupName) {
        if (adGroupName == null) {
            return null;
        }
        Matcher matcher = GROUP_STYLE.matcher(adGroupName);
        return matcher.find() ? matcher.group(1).toUpperCase(Locale.ROOT) : null;
    }
}
