package com.example.resq_ai.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record ImageMetadata(String format, int width, int height, BigDecimal sizeKb) {

    public static ImageMetadata of(DecodedMedia image) {
        BigDecimal kb = BigDecimal.valueOf(image.encodedSize())
                .divide(BigDecimal.valueOf(1024), 2, RoundingMode.HALF_UP);
        return new ImageMetadata(image.format(), image.width(), image.height(), kb);
    }

    public String dimensions() {
        return width + "x" + height;
    }
}
