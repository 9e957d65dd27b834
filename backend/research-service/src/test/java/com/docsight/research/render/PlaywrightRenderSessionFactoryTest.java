package com.docsight.research.render;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 브라우저 없이 세션 수명 주기만 검증
 */
@ExtendWith(MockitoExtension.class)
class PlaywrightRenderSessionFactoryTest {

    private static final String URL = "https://app.example.com/";

    @Mock
    private Playwright playwright;

    @Mock
    private Browser browser;

    @Mock
    private BrowserContext context;

    @Mock
    private Page page;

    private PlaywrightRenderSessionFactory.PlaywrightRenderSession session() {
        return new PlaywrightRenderSessionFactory.PlaywrightRenderSession(playwright, browser, "TestAgent");
    }

    @Test
    @DisplayName("렌더링 후 페이지 내용과 제목을 돌려주고 컨텍스트를 닫는다")
    void rendersAndClosesContext() {
        when(browser.newContext(any(Browser.NewContextOptions.class))).thenReturn(context);
        when(context.newPage()).thenReturn(page);
        when(page.content()).thenReturn("<main>hi</main>");
        when(page.title()).thenReturn("App");

        RenderedPage rendered = session().render(URL, Duration.ofSeconds(5));

        assertThat(rendered.html()).isEqualTo("<main>hi</main>");
        assertThat(rendered.title()).isEqualTo("App");
        verify(context).close();
    }

    @Test
    @DisplayName("탐색이 실패해도 컨텍스트는 닫힌다")
    void closesContextOnNavigationFailure() {
        when(browser.newContext(any(Browser.NewContextOptions.class))).thenReturn(context);
        when(context.newPage()).thenReturn(page);
        when(page.navigate(eq(URL), any(Page.NavigateOptions.class)))
                .thenThrow(new PlaywrightException("Timeout 5000ms exceeded"));

        assertThatThrownBy(() -> session().render(URL, Duration.ofSeconds(5)))
                .isInstanceOf(PlaywrightException.class);
        verify(context).close();
    }

    @Test
    @DisplayName("브라우저 종료가 실패해도 예외 없이 Playwright를 정리한다")
    void closeNeverThrows() {
        doThrow(new PlaywrightException("Target closed")).when(browser).close();

        assertThatCode(() -> session().close()).doesNotThrowAnyException();
        verify(playwright).close();
    }

    @Test
    @DisplayName("Playwright 드라이버 종료가 실패해도 close는 예외를 던지지 않는다")
    void closeSurvivesDriverShutdownFailure() {
        doThrow(new PlaywrightException("Driver exited")).when(playwright).close();

        assertThatCode(() -> session().close()).doesNotThrowAnyException();
        verify(browser).close();
    }
}
