package fun.fengwk.pagecap.core.service.capture.parser;

import java.util.List;

/**
 * Fixed noise rule set shared by the html tree filter and the live page cleaner.
 *
 * @author fengwk
 */
public final class NoiseRules {

    private static final List<String> CLASS_AND_ID = List.of("class", "id");

    /**
     * Elements wrapping one of these are kept whatever rule they match.
     */
    public static final String CONTENT_LANDMARKS = "main, article, [role=main]";

    public static final List<NoiseRule> DEFAULT = List.of(
        NoiseRule.tags("landmarks", "header", "nav", "footer", "aside"),
        NoiseRule.attributes(
            "landmark-roles",
            List.of("role"),
            List.of("navigation", "banner", "contentinfo", "complementary", "search"),
            List.of()
        ),
        NoiseRule.tags("scripts", "script", "style", "noscript", "template"),
        NoiseRule.attributes(
            "advertising",
            CLASS_AND_ID,
            List.of("ad", "ads", "advert", "advertisement", "adsbygoogle", "sponsor", "sponsored", "promo"),
            List.of("advert")
        ),
        new NoiseRule(
            "overlays",
            List.of("dialog"),
            List.of("class", "id", "role"),
            List.of("dialog", "alertdialog"),
            List.of("modal", "overlay", "popup", "lightbox")
        ),
        NoiseRule.attributes(
            "cookie-consent",
            CLASS_AND_ID,
            List.of(),
            List.of("cookie", "consent", "gdpr")
        ),
        NoiseRule.attributes(
            "page-chrome",
            CLASS_AND_ID,
            List.of("sidebar", "navbar", "menu", "breadcrumb", "breadcrumbs", "share", "social", "toc",
                "headerlink", "copybutton"),
            List.of("mw-editsection")
        )
    );

    private NoiseRules() {
    }

}
