package com.example.mediareconcile.api.request;

import java.util.List;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class CopyFilesRequest {

    @NotEmpty
    private List<String> sourcePaths;

    @NotBlank
    private String targetCategory;
}
