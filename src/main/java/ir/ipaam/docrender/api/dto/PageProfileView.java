package ir.ipaam.docrender.api.dto;

import ir.ipaam.docrender.domain.model.page.PageProfile;

import java.util.Locale;

public record PageProfileView(String name, double widthMm, double heightMm) {

    public static PageProfileView of(PageProfile profile) {
        return new PageProfileView(profile.name().toLowerCase(Locale.ROOT), profile.widthMm(), profile.heightMm());
    }
}
