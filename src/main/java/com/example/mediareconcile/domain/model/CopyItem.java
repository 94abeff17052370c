package com.example.mediareconcile.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CopyItem {

    private String file;

    private String target;

    private String error;

    private TagRecord tags;

    public static CopyItem success(String file, String target, TagRecord tags) {
        CopyItem item = new CopyItem();
        item.setFile(file);
        item.setTarget(target);
        item.setTags(tags);
        return item;
    }

    public static CopyItem duplicate(String file, String target) {
        CopyItem item = new CopyItem();
        item.setFile(file);
        item.setTarget(target);
        return item;
    }

    public static CopyItem failed(String file, String error) {
        CopyItem item = new CopyItem();
        item.setFile(file);
        item.setError(error);
        return item;
    }
}
