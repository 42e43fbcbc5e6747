package com.shlokmestry.gateway.auth;

import java.io.IOException;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@FunctionalInterface
public interface AdminHandler {

    void handle(HttpServletRequest request, HttpServletResponse response) throws IOException, ServletException;
}
