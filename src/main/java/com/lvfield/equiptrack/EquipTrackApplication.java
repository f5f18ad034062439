package com.lvfield.equiptrack;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@MapperScan("com.lvfield.equiptrack.mapper")  // 指定 Mapper 接口所在的包路径
@ConfigurationPropertiesScan
@SpringBootApplication
public class EquipTrackApplication {

	public static void main(String[] args) {
		SpringApplication.run(EquipTrackApplication.class, args);
	}

}
