package com.fieldservice.sale;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FieldServiceSaleApplication {

	public static void main(String[] args) {
		SpringApplication.run(FieldServiceSaleApplication.class, args);
	}

}
