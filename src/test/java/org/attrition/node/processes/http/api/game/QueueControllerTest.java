package org.attrition.node.processes.http.api.game;

import com.typesafe.config.ConfigFactory;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.attrition.engine.GameEngine;
import org.attrition.engine.admission.AdmissionRequest;
import org.attrition.engine.admission.QueueAdmissions;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.model.QueueType;
import org.attrition.engine.scheduling.CancelResult;
import org.attrition.engine.scheduling.CancellationService;
import org.attrition.node.processes.http.api.game.dto.CancelResponseDto;
import org.attrition.node.processes.http.api.game.dto.StartRequestDto;
import org.attrition.node.spi.ServiceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Request parsing of the queue endpoints with a mocked Javalin context. No server, no store.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("QueueController Unit Tests")
class QueueControllerTest {

    @Mock
    private GameEngine engine;
    @Mock
    private QueueAdmissions admissions;
    @Mock
    private CancellationService cancellation;
    @Mock
    private Context ctx;
    @Captor
    private ArgumentCaptor<AdmissionRequest> requestCaptor;
    @Captor
    private ArgumentCaptor<Object> jsonCaptor;

    private QueueController controller;

    @BeforeEach
    void setUp() {
        when(engine.getAdmissions()).thenReturn(admissions);
        when(engine.getCancellation()).thenReturn(cancellation);
        when(ctx.status(any(HttpStatus.class))).thenReturn(ctx);
        ServiceRegistry registry = new ServiceRegistry();
        registry.register(GameEngine.class, engine);
        controller = new QueueController(registry, ConfigFactory.empty());
    }

    @Nested
    @DisplayName("Start")
    class Start {

        @Test
        @DisplayName("Should pass the trimmed empire and the body to the admission pipeline")
        void passesRequestToPipeline() {
            when(ctx.pathParam("queue")).thenReturn("units");
            when(ctx.header("X-Empire-Id")).thenReturn(" empire-1 ");
            when(ctx.body()).thenReturn("{...}");
            when(ctx.bodyAsClass(StartRequestDto.class)).thenReturn(new StartRequestDto("A00:10:20:10", "fighters", 3));
            when(admissions.start(eq(QueueType.UNITS), eq("empire-1"), any()))
                .thenThrow(new GameException(ErrorCode.INSUFFICIENT_RESOURCES, "Not enough credits."));

            assertThatThrownBy(() -> controller.handleStart(ctx))
                .isInstanceOfSatisfying(GameException.class,
                    e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INSUFFICIENT_RESOURCES));

            verify(admissions).start(eq(QueueType.UNITS), eq("empire-1"), requestCaptor.capture());
            AdmissionRequest request = requestCaptor.getValue();
            assertThat(request.locationCoord()).isEqualTo("A00:10:20:10");
            assertThat(request.catalogKey()).isEqualTo("fighters");
            assertThat(request.quantityOrDefault()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should reject an unknown queue as NOT_FOUND")
        void unknownQueue() {
            when(ctx.pathParam("queue")).thenReturn("fleets");

            assertThatThrownBy(() -> controller.handleStart(ctx))
                .isInstanceOfSatisfying(GameException.class,
                    e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_FOUND));
            verifyNoInteractions(admissions);
        }

        @Test
        @DisplayName("Should reject a blank body")
        void blankBody() {
            when(ctx.pathParam("queue")).thenReturn("structures");
            when(ctx.header("X-Empire-Id")).thenReturn("empire-1");
            when(ctx.body()).thenReturn("  ");

            assertThatThrownBy(() -> controller.handleStart(ctx))
                .isInstanceOfSatisfying(GameException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_REQUEST);
                    assertThat(e.getDetails()).containsEntry("field", "body");
                });
            verifyNoInteractions(admissions);
        }

        @Test
        @DisplayName("Should require the empire header")
        void missingHeader() {
            when(ctx.pathParam("queue")).thenReturn("research");

            assertThatThrownBy(() -> controller.handleStart(ctx))
                .isInstanceOfSatisfying(GameException.class,
                    e -> assertThat(e.getDetails()).containsEntry("field", "X-Empire-Id"));
        }
    }

    @Nested
    @DisplayName("Cancel")
    class Cancel {

        @Test
        @DisplayName("Should answer with the cancellation outcome")
        void respondsWithOutcome() {
            when(ctx.pathParam("queue")).thenReturn("structures");
            when(ctx.pathParam("id")).thenReturn("42");
            when(ctx.header("X-Empire-Id")).thenReturn("empire-1");
            when(cancellation.cancel(QueueType.STRUCTURES, "empire-1", 42L)).thenReturn(new CancelResult(42L, true, false, 8L));

            controller.handleCancel(ctx);

            verify(ctx).status(HttpStatus.OK);
            verify(ctx).json(jsonCaptor.capture());
            assertThat(jsonCaptor.getValue()).isInstanceOfSatisfying(CancelResponseDto.class, dto -> {
                assertThat(dto.cancelledId()).isEqualTo("42");
                assertThat(dto.revertedUpgrade()).isTrue();
                assertThat(dto.refundedCredits()).isEqualTo(8L);
            });
        }

        @Test
        @DisplayName("Should reject a non-numeric id before touching the store")
        void nonNumericId() {
            when(ctx.pathParam("queue")).thenReturn("research");
            when(ctx.pathParam("id")).thenReturn("abc");
            when(ctx.header("X-Empire-Id")).thenReturn("empire-1");

            assertThatThrownBy(() -> controller.handleCancel(ctx))
                .isInstanceOfSatisfying(GameException.class,
                    e -> assertThat(e.getDetails()).containsEntry("field", "id"));
            verify(cancellation, never()).cancel(any(), anyString(), anyLong());
        }
    }
}
