package cn.bitsleep.sysdocs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

// identities come from session tokens, no in-memory user store
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class SysDocsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SysDocsApplication.class, args);
    }

}
