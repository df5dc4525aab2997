package dev.jobapplier.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;

/**
 * Configuration for loading the AnswerBook from answers.json.
 */
@Slf4j
@Configuration
public class AnswerBookConfig {

  @Bean
  public AnswerBook answerBook(ObjectMapper objectMapper,
      @Value("${app.answers-file:answers.json}") String answersFile) {
    File file = new File(answersFile);
    if (!file.exists()) {
      log.warn("{} not found. Using an empty answer book.", answersFile);
      return new AnswerBook();
    }

    try {
      AnswerBook book = objectMapper.readValue(file, AnswerBook.class);
      log.info("Loaded {} static answers from {}", book.getAnswers().size(), answersFile);
      return book;
    } catch (IOException e) {
      log.error("Failed to load {}. Ensure it matches the required structure.", answersFile, e);
      throw new IllegalStateException("Could not load answer book", e);
    }
  }
}
