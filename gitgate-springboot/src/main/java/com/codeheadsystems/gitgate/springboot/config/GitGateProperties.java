package com.codeheadsystems.gitgate.springboot.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gitgate")
public class GitGateProperties {

  private List<String> permitAllPaths = new ArrayList<>(List.of("/actuator/health"));

  public List<String> getPermitAllPaths() {
    return permitAllPaths;
  }

  public void setPermitAllPaths(List<String> permitAllPaths) {
    this.permitAllPaths = permitAllPaths;
  }
}
