package com.titan.cargo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.titan.cargo.model.enums.Role;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Date;

@Data
@NoArgsConstructor
@Document(collection = "users")
public class User {

    @Id
    private String id;

    private String name;

    // Matched exactly as stored, no case folding.
    @Indexed(unique = true)
    private String email;

    @JsonIgnore
    private String password;

    private Role role;
    private String phone;
    private String address;
    private Date createdAt;
    private Date lastLogin;
}
