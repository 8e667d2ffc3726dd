package ir.ipaam.docrender.api.mapper;

import ir.ipaam.docrender.api.dto.ExportRequest;
import ir.ipaam.docrender.config.RenderProperties;
import ir.ipaam.docrender.domain.model.page.PageConfig;
import ir.ipaam.docrender.domain.model.page.PageProfile;

/**
 * Editor settings to page geometry. Values are copied as given; the engine
 * rejects impossible geometry with a configuration error.
 */
public final class ExportSettingsMapper {
    private ExportSettingsMapper() {}

    public static PageConfig toPageConfig(ExportRequest.Settings s, RenderProperties defaults) {
        PageProfile fallback = PageProfile.fromName(defaults.getPageSize()).orElse(PageProfile.A4);
        if (s == null) {
            return new PageConfig(fallback.widthMm(), fallback.heightMm(),
                    defaults.getMarginMm(), defaults.getLineSpacing());
        }

        // a single custom dimension overrides that side of the profile only
        PageProfile profile = PageProfile.fromName(s.getPageSize()).orElse(fallback);
        double width = s.getPageWidthMm() != null ? s.getPageWidthMm() : profile.widthMm();
        double height = s.getPageHeightMm() != null ? s.getPageHeightMm() : profile.heightMm();
        double margin = s.getMarginMm() != null ? s.getMarginMm() : defaults.getMarginMm();
        double spacing = s.getLineSpacing() != null ? s.getLineSpacing() : defaults.getLineSpacing();
        return new PageConfig(width, height, margin, spacing);
    }
}
