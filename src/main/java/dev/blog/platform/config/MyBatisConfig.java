package dev.blog.platform.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

/**
 * MyBatis configuration class
 * Mapper XML locations and type handlers are set in application.yml
 */
@Configuration
@MapperScan("dev.blog.platform.mapper")
public class MyBatisConfig {
}
