package com.prismTax.simulator.emitter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReplyButton {
    private String id;
    private String title;

    public static ReplyButton of(String id, String title) {
        return new ReplyButton(id, title);
    }
}
