package org.docshare.sharing.dto.request;

public record ActorRequest(String actorId) {
}
