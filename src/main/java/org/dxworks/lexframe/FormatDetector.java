package org.dxworks.lexframe;

import org.dxworks.lexframe.html.HtmlNode;

public class FormatDetector {

    private FormatDetector() {
    }

    /**
     * Consolidated texts carry {@code p.title-article-norm} article titles or
     * {@code div.grid-container} point layouts; everything else is read as an
     * Official Journal page.
     */
    public static DocumentFormat detect(HtmlNode document) {
        if (document.selectFirst("p.title-article-norm") != null
                || document.selectFirst("div.grid-container") != null) {
            return DocumentFormat.CONSOLIDATED;
        }
        return DocumentFormat.OJ;
    }
}
