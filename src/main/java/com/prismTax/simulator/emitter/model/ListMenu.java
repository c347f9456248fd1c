package com.prismTax.simulator.emitter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * WhatsApp-style list message: a header, a trigger button and titled sections of selectable rows.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ListMenu {

    private String header;

    private String buttonText;

    private String footer;

    private List<Section> sections;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Section {
        private String title;
        private List<Row> rows;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Row {
        private String id;
        private String title;
        private String description;
    }
}
