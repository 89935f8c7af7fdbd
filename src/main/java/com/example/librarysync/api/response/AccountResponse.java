package com.example.librarysync.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccountResponse {

    private Long id;

    private String name;

    private String catalogUsername;

    private Boolean enabled;
}
