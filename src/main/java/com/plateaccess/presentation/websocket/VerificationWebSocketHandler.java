package com.plateaccess.presentation.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plateaccess.application.dto.OwnerRecordDto;
import com.plateaccess.application.dto.VerificationAttemptDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Handler de WebSocket para enviar intentos de verificación y cambios del
 * registro en tiempo real a los clientes.
 */
@Component
@Slf4j
public class VerificationWebSocketHandler extends TextWebSocketHandler {

    private final CopyOnWriteArraySet<WebSocketSession> sessions = new CopyOnWriteArraySet<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.add(session);
        log.info("Nueva conexión WebSocket: {} (Total: {})", session.getId(), sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session);
        log.info("Conexión WebSocket cerrada: {} (Restantes: {})", session.getId(), sessions.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Mensaje recibido de {}: {}", session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Error en WebSocket {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session);
    }

    /**
     * Envía un intento de verificación recién registrado.
     *
     * @param attempt DTO del intento
     */
    public void broadcastAttempt(VerificationAttemptDto attempt) {
        broadcast("NEW_ATTEMPT", attempt);
    }

    /**
     * Notifica el alta de un propietario.
     *
     * @param owner DTO del propietario registrado
     */
    public void broadcastOwnerRegistered(OwnerRecordDto owner) {
        broadcast("OWNER_REGISTERED", owner);
    }

    /**
     * Notifica la baja de un propietario.
     *
     * @param ownerId Identificador del propietario eliminado
     */
    public void broadcastOwnerRemoved(String ownerId) {
        broadcast("OWNER_REMOVED", new OwnerRemovedData(ownerId));
    }

    public int getConnectedClients() {
        return sessions.size();
    }

    private void broadcast(String type, Object data) {
        if (sessions.isEmpty()) {
            log.debug("No hay clientes WebSocket conectados");
            return;
        }

        TextMessage message;
        try {
            message = new TextMessage(objectMapper.writeValueAsString(new WebSocketMessage(type, data)));
        } catch (IOException e) {
            log.error("Error creando mensaje JSON {}: {}", type, e.getMessage());
            return;
        }

        for (WebSocketSession session : sessions) {
            if (session.isOpen()) {
                try {
                    session.sendMessage(message);
                } catch (IOException e) {
                    log.error("Error enviando a sesión {}: {}", session.getId(), e.getMessage());
                    sessions.remove(session);
                }
            }
        }
        log.debug("Broadcast {} enviado a {} clientes", type, sessions.size());
    }

    record WebSocketMessage(String type, Object data) {
    }

    record OwnerRemovedData(String ownerId) {
    }
}
