package dev.jobapplier;

import dev.jobapplier.ai.AnswerGenerator;
import dev.jobapplier.ai.NoOpAnswerGenerator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean
  private QuestionBankRunner questionBankRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private AnswerGenerator answerGenerator;

  @Test
  void contextLoads() {
    assertThat(answerGenerator).isInstanceOf(NoOpAnswerGenerator.class);
  }
}
