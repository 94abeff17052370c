package com.example.mediareconcile.api.response;

import java.util.Map;
import lombok.Data;

@Data
public class MediaDirectoryResponse {

    private String mediaDirectory;

    private boolean externalConfigured;

    private String externalPath;

    private Map<String, String> categories;
}
