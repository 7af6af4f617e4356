package ippnotify.common.component;

import java.util.Collections;

import org.springframework.security.authentication.ProviderManager;
import org.springframework.security.authentication.dao.DaoAuthenticationProvider;
import org.springframework.stereotype.Component;

@Component
public class IppAuthenticationManager extends ProviderManager {

    public IppAuthenticationManager(DaoAuthenticationProvider daoAuthenticationProvider) {
        super(Collections.singletonList(daoAuthenticationProvider));
    }
}
