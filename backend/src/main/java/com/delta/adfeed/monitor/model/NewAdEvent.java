package com.delta.adfeed.monitor.model;

public record NewAdEvent(AdRecord ad, String targetUrl) {
}
