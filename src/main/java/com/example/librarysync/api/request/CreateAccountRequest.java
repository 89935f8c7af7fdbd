package com.example.librarysync.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateAccountRequest {

    @NotBlank
    @Size(max = 128)
    private String name;

    @NotBlank
    @Size(max = 255)
    private String catalogUsername;

    @NotBlank
    private String catalogPassword;

    private Boolean enabled = true;
}
