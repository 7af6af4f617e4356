package ippnotify.common.configuration;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authentication.dao.DaoAuthenticationProvider;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;

@Configuration
@EnableConfigurationProperties({SecurityProperties.class})
public class UserDetailsConfiguration {

    @Bean
    public InMemoryUserDetailsManager userDetailsService(SecurityProperties securityProperties) {
        List<UserDetails> users = new ArrayList<>();
        for (AuthorizedUser user : securityProperties.getAuthorizedUsers()) {
            users.add(User.withUsername(user.getUsername()).password(user.getPassword())
                            .roles(user.getRolesCollection().toArray(new String[0])).build());
        }
        return new InMemoryUserDetailsManager(users);
    }

    @Bean
    public DaoAuthenticationProvider daoAuthenticationProvider(InMemoryUserDetailsManager userDetailsService) {
        DaoAuthenticationProvider authenticationProvider = new DaoAuthenticationProvider();
        authenticationProvider.setUserDetailsService(userDetailsService);
        authenticationProvider.setPasswordEncoder(PasswordEncoderFactories.createDelegatingPasswordEncoder());
        return authenticationProvider;
    }
}
