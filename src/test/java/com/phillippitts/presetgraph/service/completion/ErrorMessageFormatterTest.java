package com.phillippitts.presetgraph.service.completion;

import com.phillippitts.presetgraph.exception.ProviderException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorMessageFormatterTest {

    private final ErrorMessageFormatter formatter = new ErrorMessageFormatter(ErrorMessageFormatter.defaultMessages());

    @Test
    void missingKeyNamesTheProvider() {
        assertThat(formatter.format(ProviderException.missingApiKey("google"), "gemini-2.5-flash", "en"))
                .isEqualTo("You haven't entered a Google Gemini API key!");
    }

    @Test
    void rateLimitMentionsModelAndProvider() {
        assertThat(formatter.format(ProviderException.httpError("groq", 429, "slow"), "llama-3.1-8b", "en"))
                .isEqualTo("Error 429: Rate limit exceeded for model llama-3.1-8b (Groq). Please wait a moment and try again.");
    }

    @Test
    void notFoundWithoutModelSaysThis() {
        assertThat(formatter.format(ProviderException.httpError("openai", 404, ""), null, "en"))
                .isEqualTo("Error 404: Model this not found on OpenAI.");
    }

    @Test
    void unlistedStatusUsesGenericHttpText() {
        assertThat(formatter.format(ProviderException.httpError("anthropic", 418, "teapot"), "claude", "en"))
                .isEqualTo("Error 418: An error occurred with claude (Anthropic) (HTTP 418).");
    }

    @Test
    void nonHttpFailureUsesGenericText() {
        assertThat(formatter.format(new IllegalStateException("socket closed"), "m", "en"))
                .isEqualTo("Error: socket closed");
    }

    @Test
    void unknownProviderIdIsShownAsIs() {
        assertThat(ErrorMessageFormatter.displayName("mistral")).isEqualTo("mistral");
        assertThat(ErrorMessageFormatter.displayName("")).isEqualTo("API");
        assertThat(ErrorMessageFormatter.displayName(null)).isEqualTo("API");
    }

    @Test
    void localizesToSupportedLanguages() {
        ProviderException missing = ProviderException.missingApiKey("groq");

        assertThat(formatter.format(missing, "m", "vi")).isEqualTo("Bạn chưa nhập Groq API key!");
        assertThat(formatter.format(missing, "m", "ko")).contains("Groq");
        assertThat(formatter.format(missing, "m", "ja")).contains("Groq");
        assertThat(formatter.format(missing, "m", "zh")).contains("Groq");
        assertThat(formatter.format(missing, "m", "ko")).isNotEqualTo(formatter.format(missing, "m", "en"));
    }

    @Test
    void unknownLanguageFallsBackToEnglish() {
        assertThat(formatter.format(ProviderException.missingApiKey("groq"), "m", "xx"))
                .isEqualTo("You haven't entered a Groq API key!");
        assertThat(formatter.retrying("m2", null)).isEqualTo("(Retrying m2...)");
    }

    @Test
    void retryNoticeIsLocalized() {
        assertThat(formatter.retrying("m2", "vi")).isEqualTo("(Đang thử lại m2...)");
    }
}
