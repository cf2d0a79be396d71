package com.example.imagebot.conversion.config;

import com.example.imagebot.conversion.controller.ConversionChatController;
import com.example.imagebot.conversion.support.TempFileStorage;
import com.example.imagebot.conversion.transport.ChatTransport;
import com.example.imagebot.conversion.transport.ChatUpdateDispatcher;
import com.example.imagebot.conversion.transport.telegram.ImageConverterBot;
import com.example.imagebot.conversion.transport.telegram.TelegramChatTransport;
import com.example.imagebot.conversion.transport.telegram.TelegramSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.BotSession;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

@Slf4j
@Configuration
public class TelegramBotConfiguration {

    @Bean
    public TelegramSender telegramSender(@Value("${app.telegram.bot-token:}") String botToken) {
        return new TelegramSender(botToken);
    }

    @Bean
    public ChatTransport chatTransport(TelegramSender telegramSender, TempFileStorage storage) {
        return new TelegramChatTransport(telegramSender, storage);
    }

    @Bean
    @ConditionalOnExpression("!'${app.telegram.bot-token:}'.isEmpty()")
    public ImageConverterBot imageConverterBot(@Value("${app.telegram.bot-token}") String botToken,
            @Value("${app.telegram.bot-username:image_format_changer_bot}") String botUsername,
            ConversionChatController controller,
            ChatUpdateDispatcher dispatcher) {
        return new ImageConverterBot(botToken, botUsername, controller, dispatcher);
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnExpression("!'${app.telegram.bot-token:}'.isEmpty()")
    public BotSession telegramBotSession(ImageConverterBot bot) throws TelegramApiException {
        TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
        BotSession session = botsApi.registerBot(bot);
        log.info("Registered Telegram bot {} for long polling", bot.getBotUsername());
        return session;
    }
}
