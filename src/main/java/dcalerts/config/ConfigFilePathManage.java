package dcalerts.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ConfigFilePathManage {

    @Value("${dcalerts.config.path}")
    public String dashboardConfigPath;
}
