package ippnotify.common.configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.stream.Collectors;

import javax.validation.constraints.NotBlank;

import org.apache.commons.lang3.StringUtils;

public class AuthorizedUser {

    @NotBlank
    private String username;
    @NotBlank
    private String password;
    private String roles;

    public void setUsername(String username) {
        this.username = username;
    }

    public String getUsername() {
        return username;
    }

    /**
     * Password in Spring Security's delegating format, e.g. {@code {noop}secret} or {@code {bcrypt}...}.
     */
    public void setPassword(String password) {
        this.password = password;
    }

    public String getPassword() {
        return password;
    }

    public void setRoles(String roles) {
        this.roles = roles;
    }

    public String getRoles() {
        return roles;
    }

    public Collection<String> getRolesCollection() {
        if (this.roles == null) {
            return new ArrayList<>();
        } else {
            return Arrays.stream(StringUtils.split(this.roles, ',')).map(String::trim).collect(Collectors.toSet());
        }
    }
}
