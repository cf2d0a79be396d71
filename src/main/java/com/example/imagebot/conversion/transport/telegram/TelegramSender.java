package com.example.imagebot.conversion.transport.telegram;

import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;

public class TelegramSender extends DefaultAbsSender {

    public TelegramSender(String botToken) {
        super(new DefaultBotOptions(), botToken);
    }
}
