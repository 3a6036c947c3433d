/*
 * どこで: Team Balancer アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジューラ有効化を行う
 * なぜ: API + 期限切れ Worker + 起動時復旧を単一アプリとして起動するため
 */
package com.example.teambalancer;

import com.example.common.config.ClockConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(ClockConfig.class)
public class TeamBalancerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TeamBalancerApplication.class, args);
  }
}
