package com.scholary.recipe.media;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecipeMediaApplication {

  public static void main(String[] args) {
    SpringApplication.run(RecipeMediaApplication.class, args);
  }
}
